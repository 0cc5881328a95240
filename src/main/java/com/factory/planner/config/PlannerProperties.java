package com.factory.planner.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration properties for the production planner.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "planner")
public class PlannerProperties {

    /**
     * OR-Tools backend passed to {@code MPSolver.createSolver}. GLOP is a pure LP simplex.
     */
    private String solverId = "GLOP";

    /**
     * Wall-clock limit for a single solve, in milliseconds.
     */
    private long timeLimitMs = 10_000;

    private Demo demo = new Demo();

    @Data
    public static class Demo {
        /** Run the smelting demo on startup. */
        private boolean enabled = false;
    }
}
