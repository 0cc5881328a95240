package com.factory.planner.engine;

import lombok.Value;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Solver-independent description of a maximization LP over continuous variables.
 * Variables and constraints keep the order they were added in.
 */
public class LinearProgram {

    public enum Comparison {
        LESS_OR_EQUAL,
        EQUAL,
        GREATER_OR_EQUAL
    }

    @Value
    public static class Variable {
        String name;
        double lowerBound;
        double upperBound;
        double objectiveCoefficient;
    }

    @Value(staticConstructor = "of")
    public static class Term {
        int variable;
        double coefficient;
    }

    @Value
    public static class LinearConstraint {
        String name;
        List<Term> terms;
        Comparison comparison;
        double rhs;
    }

    private final List<Variable> variables = new ArrayList<>();
    private final List<LinearConstraint> constraints = new ArrayList<>();

    /**
     * @return column index of the new variable
     */
    public int addVariable(String name, double lowerBound, double upperBound, double objectiveCoefficient) {
        variables.add(new Variable(name, lowerBound, upperBound, objectiveCoefficient));
        return variables.size() - 1;
    }

    public void addConstraint(String name, List<Term> terms, Comparison comparison, double rhs) {
        for (Term term : terms) {
            if (term.getVariable() < 0 || term.getVariable() >= variables.size()) {
                throw new IllegalArgumentException("Constraint " + name + " uses unknown column " + term.getVariable());
            }
        }
        constraints.add(new LinearConstraint(name, List.copyOf(terms), comparison, rhs));
    }

    public List<Variable> getVariables() {
        return Collections.unmodifiableList(variables);
    }

    public List<LinearConstraint> getConstraints() {
        return Collections.unmodifiableList(constraints);
    }
}
