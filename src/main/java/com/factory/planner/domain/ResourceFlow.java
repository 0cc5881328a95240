package com.factory.planner.domain;

import lombok.Value;

import java.util.List;

@Value
public class ResourceFlow {
    ResourceId resource;
    double netRate;
    List<Contribution> contributions;

    public boolean isActive() {
        return !contributions.isEmpty();
    }
}
