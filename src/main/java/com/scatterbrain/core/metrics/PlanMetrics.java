package com.scatterbrain.core.metrics;

import com.scatterbrain.core.events.EventBus;
import com.scatterbrain.core.plan.ErrorKind;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.FunctionCounter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Service;

import java.util.Locale;

/**
 * Centralised Micrometer metrics for plan operations.
 * <p>
 * Mutations are counted by the plan store as they commit, independently of event delivery.
 */
@Service
public class PlanMetrics {

    private final MeterRegistry registry;

    public PlanMetrics(MeterRegistry registry, EventBus eventBus) {
        this.registry = registry;
        FunctionCounter.builder("scatterbrain.events.dropped", eventBus, EventBus::droppedSubscriberCount)
                .description("Event subscribers dropped for falling behind")
                .register(registry);
    }

    public void recordMutation(String eventType) {
        Counter.builder("scatterbrain.mutations.total")
                .description("Committed plan mutations")
                .tag("type", eventType)
                .register(registry)
                .increment();
    }

    public void recordLeaseIssued() {
        Counter.builder("scatterbrain.leases.issued")
                .register(registry)
                .increment();
    }

    /**
     * @param outcome "leased", "forced", or the lower-cased error kind of a refused completion
     */
    public void recordCompletion(String outcome) {
        Counter.builder("scatterbrain.completions.total")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    public void recordError(ErrorKind kind) {
        Counter.builder("scatterbrain.errors.total")
                .tag("kind", kind.name().toLowerCase(Locale.ROOT))
                .register(registry)
                .increment();
    }
}
