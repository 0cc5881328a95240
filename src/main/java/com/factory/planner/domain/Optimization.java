package com.factory.planner.domain;

import lombok.Value;

/**
 * One term of the objective: {@code coefficient * variable}.
 */
@Value(staticConstructor = "of")
public class Optimization {
    VariableId variable;
    double coefficient;
}
