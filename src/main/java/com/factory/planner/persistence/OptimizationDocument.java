package com.factory.planner.persistence;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Objective term by name: {@code {"kind": "Resource", "name": "Iron Ingot", "coefficient": 1.0}}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class OptimizationDocument {
    private String kind; // "Resource" or "Recipe"
    private String name;
    private double coefficient;
}
