package com.factory.planner.domain;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Ordered rules as a user composed them; the unit the rule-list document stores.
 */
@Value
@Builder
public class RuleList {
    @Singular
    List<Rule> rules;
}
