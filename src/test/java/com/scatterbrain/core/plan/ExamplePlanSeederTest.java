package com.scatterbrain.core.plan;

import com.scatterbrain.core.context.ContextProjector;
import com.scatterbrain.core.events.EventBus;
import com.scatterbrain.core.lease.LeaseRegistry;
import com.scatterbrain.core.metrics.PlanMetrics;
import com.scatterbrain.core.model.IndexPath;
import com.scatterbrain.core.model.Plan;
import com.scatterbrain.core.model.Task;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ExamplePlanSeederTest {

    @Test
    @DisplayName("seeds a nested plan with two completed leaves and focus on an open task")
    void seedsExamplePlan() {
        EventBus eventBus = new EventBus(Runnable::run, 100);
        PlanStore store = new PlanStore(new LeaseRegistry(), eventBus, new ContextProjector(),
                new PlanMetrics(new SimpleMeterRegistry(), eventBus), new PlanProperties());

        long id = new ExamplePlanSeeder(store).seed();

        Plan plan = store.getPlan(id);
        assertEquals("Build a web application", plan.goal());
        assertEquals(2, plan.tasks().size());
        assertTrue(plan.find(IndexPath.of(0, 0, 0)).completed());
        assertTrue(plan.find(IndexPath.of(1, 0, 0)).completed());
        assertFalse(plan.completed());

        Task current = plan.find(plan.current());
        assertNotNull(current);
        assertFalse(current.completed());
        assertEquals(IndexPath.of(0, 1), plan.current());
    }
}
