package com.factory.planner.domain;

import lombok.Value;

import java.util.List;

/**
 * Net flow report derived from a {@link Factory}, indexed by resource id.
 */
@Value
public class NetResources {
    List<ResourceFlow> resources;

    public ResourceFlow get(ResourceId resource) {
        return resources.get(resource.getIndex());
    }
}
