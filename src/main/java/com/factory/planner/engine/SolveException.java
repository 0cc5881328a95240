package com.factory.planner.engine;

/**
 * A solve ended without an optimal assignment. The message is the user-facing
 * label of the {@link SolveFailure}.
 */
public class SolveException extends Exception {

    private final SolveFailure failure;

    public SolveException(SolveFailure failure) {
        super(failure.getLabel());
        this.failure = failure;
    }

    public SolveFailure getFailure() {
        return failure;
    }
}
