package com.factory.planner.engine;

/**
 * Optimal assignment returned by a {@link LinearSolver}, indexed by column.
 */
public class LinearSolution {

    private final double[] values;
    private final double objectiveValue;

    public LinearSolution(double[] values, double objectiveValue) {
        this.values = values.clone();
        this.objectiveValue = objectiveValue;
    }

    public double value(int column) {
        return values[column];
    }

    public int size() {
        return values.length;
    }

    public double getObjectiveValue() {
        return objectiveValue;
    }
}
