package com.factory.planner.domain;

import lombok.Value;

@Value(staticConstructor = "of")
public class Rule {
    VariableId variable;
    Constraint constraint;
}
