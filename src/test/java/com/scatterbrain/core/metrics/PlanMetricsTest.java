package com.scatterbrain.core.metrics;

import com.scatterbrain.core.events.EventBus;
import com.scatterbrain.core.events.PlanEvent;
import com.scatterbrain.core.plan.ErrorKind;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class PlanMetricsTest {

    private SimpleMeterRegistry registry;
    private EventBus eventBus;
    private PlanMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        eventBus = new EventBus(Runnable::run, 100);
        metrics = new PlanMetrics(registry, eventBus);
    }

    @Test
    @DisplayName("counts mutations by event type")
    void countsMutations() {
        metrics.recordMutation(PlanEvent.TASK_ADDED);
        metrics.recordMutation(PlanEvent.TASK_ADDED);
        metrics.recordMutation(PlanEvent.FOCUS_MOVED);

        assertEquals(2.0, registry.get("scatterbrain.mutations.total").tag("type", "task.added").counter().count());
        assertEquals(1.0, registry.get("scatterbrain.mutations.total").tag("type", "focus.moved").counter().count());
    }

    @Test
    @DisplayName("publishing on the bus does not count as a mutation")
    void busTrafficIsNotCounted() {
        eventBus.publish(new PlanEvent(PlanEvent.TASK_ADDED, 1, "0", Map.of(), Instant.now()));
        assertNull(registry.find("scatterbrain.mutations.total").counter());
    }

    @Test
    @DisplayName("records leases, completions and errors")
    void recordsCounters() {
        metrics.recordLeaseIssued();
        metrics.recordLeaseIssued();
        metrics.recordCompletion("leased");
        metrics.recordError(ErrorKind.LEASE_INVALID);

        assertEquals(2.0, registry.get("scatterbrain.leases.issued").counter().count());
        assertEquals(1.0, registry.get("scatterbrain.completions.total").tag("outcome", "leased").counter().count());
        assertEquals(1.0, registry.get("scatterbrain.errors.total").tag("kind", "lease_invalid").counter().count());
    }

    @Test
    @DisplayName("exposes the dropped subscriber count")
    void droppedSubscribers() {
        List<Runnable> parked = new ArrayList<>();
        EventBus stalled = new EventBus(parked::add, 1);
        SimpleMeterRegistry local = new SimpleMeterRegistry();
        new PlanMetrics(local, stalled);
        stalled.subscribe(1, e -> { });

        stalled.publish(new PlanEvent(PlanEvent.TASK_ADDED, 1, "0", Map.of(), Instant.now()));
        stalled.publish(new PlanEvent(PlanEvent.TASK_ADDED, 1, "1", Map.of(), Instant.now()));

        assertEquals(1.0, local.get("scatterbrain.events.dropped").functionCounter().count());
    }
}
