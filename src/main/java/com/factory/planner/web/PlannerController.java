package com.factory.planner.web;

import com.factory.planner.domain.PlanResult;
import com.factory.planner.persistence.CatalogLoadException;
import com.factory.planner.service.PlanningService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/plan")
@RequiredArgsConstructor
public class PlannerController {

    private final PlanningService planningService;

    @PostMapping
    public ResponseEntity<PlanResult> plan(@RequestBody PlanRequest request) throws CatalogLoadException {
        PlanResult result = planningService.plan(
                request.getCatalog(),
                request.getRules(),
                request.getOptimizations(),
                request.getExcludedTags()
        );
        return ResponseEntity.ok(result);
    }
}
