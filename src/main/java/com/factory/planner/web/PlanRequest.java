package com.factory.planner.web;

import com.factory.planner.persistence.CatalogDocument;
import com.factory.planner.persistence.OptimizationDocument;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class PlanRequest {
    private CatalogDocument catalog;
    private JsonNode rules; // rule-list document, e.g. {"rules": [...]}
    private List<OptimizationDocument> optimizations;
    private List<String> excludedTags;
}
