package com.factory.planner;

import com.factory.planner.domain.Catalog;
import com.factory.planner.domain.Constraint;
import com.factory.planner.domain.Optimization;
import com.factory.planner.domain.PlanResult;
import com.factory.planner.domain.Problem;
import com.factory.planner.domain.Recipe;
import com.factory.planner.domain.RecipeRate;
import com.factory.planner.domain.Resource;
import com.factory.planner.domain.ResourceId;
import com.factory.planner.domain.Rule;
import com.factory.planner.service.PlanningService;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
@ConditionalOnProperty(prefix = "planner.demo", name = "enabled", havingValue = "true")
public class DemoRunner implements CommandLineRunner {

    private final PlanningService service;

    public DemoRunner(PlanningService service) {
        this.service = service;
    }

    @Override
    public void run(String... args) throws Exception {
        System.out.println("=== STARTING FACTORY PLANNER DEMO (IRON CHAIN) ===");

        // 1. Setup Catalog
        ResourceId ore = ResourceId.of(0);
        ResourceId ingot = ResourceId.of(1);
        ResourceId plate = ResourceId.of(2);
        ResourceId rod = ResourceId.of(3);

        Catalog catalog = Catalog.build(
                List.of(Resource.named("Iron Ore"), Resource.named("Iron Ingot"),
                        Resource.named("Iron Plate"), Resource.named("Iron Rod")),
                List.of(
                        Recipe.builder().name("Iron Ingot").tag("smelter")
                                .rate(RecipeRate.of(ore, -30)).rate(RecipeRate.of(ingot, 30)).build(),
                        Recipe.builder().name("Iron Plate").tag("constructor")
                                .rate(RecipeRate.of(ingot, -30)).rate(RecipeRate.of(plate, 20)).build(),
                        Recipe.builder().name("Iron Rod").tag("constructor")
                                .rate(RecipeRate.of(ingot, -15)).rate(RecipeRate.of(rod, 15)).build()));

        // 2. Setup Problem: one normal ore node, as many plates as possible, 30 rods/min
        Problem problem = Problem.builder()
                .rule(Rule.of(ore.variableId(), Constraint.greater(-120)))
                .rule(Rule.of(rod.variableId(), Constraint.equal(30)))
                .rule(Rule.of(plate.variableId(), Constraint.unconstrained()))
                .optimization(Optimization.of(plate.variableId(), 1.0))
                .build();

        // 3. Run Optimization
        PlanResult result = service.plan(catalog, problem);

        System.out.println("\nPlanning Result: " + result.getStatus());
        System.out.println("Feasible: " + result.isFeasible());
        System.out.println("Computation Time: " + result.getComputationTimeMs() + " ms");

        if (result.isFeasible()) {
            System.out.println();
            System.out.print(result.getReport());
        }
    }
}
