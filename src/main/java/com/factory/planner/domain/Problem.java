package com.factory.planner.domain;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Input of one solve: user rules plus a sparse objective to maximize.
 * Variables missing from {@code optimizations} have coefficient 0.
 */
@Value
@Builder
public class Problem {
    @Singular
    List<Rule> rules;

    @Singular
    List<Optimization> optimizations;

    public static Problem of(RuleList ruleList, List<Optimization> optimizations) {
        return Problem.builder()
                .rules(ruleList.getRules())
                .optimizations(optimizations)
                .build();
    }
}
