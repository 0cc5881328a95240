package com.factory.planner.domain;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Scalar bound on the solved value of a single variable.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class Constraint {

    public enum Type {
        LESS,
        EQUAL,
        GREATER,
        UNCONSTRAINED
    }

    private static final Constraint UNCONSTRAINED = new Constraint(Type.UNCONSTRAINED, 0.0);

    Type type;
    double threshold;

    public static Constraint less(double threshold) {
        return new Constraint(Type.LESS, threshold);
    }

    public static Constraint equal(double threshold) {
        return new Constraint(Type.EQUAL, threshold);
    }

    public static Constraint greater(double threshold) {
        return new Constraint(Type.GREATER, threshold);
    }

    public static Constraint unconstrained() {
        return UNCONSTRAINED;
    }

    public boolean isSatisfiedBy(double value, double tolerance) {
        return switch (type) {
            case LESS -> value <= threshold + tolerance;
            case EQUAL -> Math.abs(value - threshold) <= tolerance;
            case GREATER -> value >= threshold - tolerance;
            case UNCONSTRAINED -> true;
        };
    }
}
