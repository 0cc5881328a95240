package com.factory.planner.domain;

import lombok.Value;

@Value(staticConstructor = "named")
public class Resource {
    String name;
}
