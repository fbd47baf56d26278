package com.scatterbrain.core.plan;

import com.scatterbrain.core.model.IndexPath;
import com.scatterbrain.core.model.Level;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Seeds a small example plan at startup when {@code scatterbrain.example=true}
 * (set by {@code serve --example}).
 */
@Component
@ConditionalOnProperty(name = "scatterbrain.example", havingValue = "true")
public class ExamplePlanSeeder implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(ExamplePlanSeeder.class);

    private final PlanStore planStore;

    public ExamplePlanSeeder(PlanStore planStore) {
        this.planStore = planStore;
    }

    @Override
    public void run(ApplicationArguments args) {
        long planId = seed();
        log.info("Seeded example plan {}", planId);
    }

    long seed() {
        long planId = planStore.createPlan("Build a web application",
                "Example plan created by serve --example");

        IndexPath frontend = planStore.addTask(planId, IndexPath.ROOT, "Implement frontend", Level.ISOLATION, null);
        IndexPath components = planStore.addTask(planId, frontend, "Design UI components", Level.ORDERING, null);
        IndexPath authUi = planStore.addTask(planId, components, "Implement user authentication UI",
                Level.IMPLEMENTATION, null);
        planStore.completeTask(planId, authUi, null, true, "Auth UI done.");
        IndexPath stateManagement = planStore.addTask(planId, frontend, "Set up state management",
                Level.ORDERING, "Pick a store library before wiring components");

        IndexPath backend = planStore.addTask(planId, IndexPath.ROOT, "Implement backend", Level.ISOLATION, null);
        IndexPath database = planStore.addTask(planId, backend, "Set up database", Level.ORDERING, null);
        IndexPath endpoints = planStore.addTask(planId, database, "Create API endpoints", Level.IMPLEMENTATION, null);
        planStore.completeTask(planId, endpoints, null, true, "Basic CRUD endpoints added.");

        planStore.moveTo(planId, stateManagement);
        return planId;
    }
}
