package com.scatterbrain.dispatch.api;

import com.scatterbrain.core.events.EventBus;
import com.scatterbrain.core.events.EventProperties;
import com.scatterbrain.core.events.PlanEvent;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Bridges {@link EventBus} subscriptions to {@link SseEmitter} instances for SSE streaming.
 * <p>
 * When a client connects to the SSE endpoint, this service creates an emitter, subscribes
 * to the EventBus for that plan, and forwards events as SSE data frames. Handles emitter
 * lifecycle (completion, timeout, error) by cleaning up subscriptions. The stream ends after
 * the plan's deletion event, and also when the bus drops the subscription for falling behind;
 * the client is expected to reconnect and re-fetch the plan.
 * <p>
 * Heartbeats are sent as SSE comments (lines starting with ':') which are ignored by
 * EventSource clients but keep idle connections open through proxies.
 */
@Service
public class SseStreamingService {

    private static final Logger log = LoggerFactory.getLogger(SseStreamingService.class);

    private final EventBus eventBus;
    private final long timeoutMs;
    private final long heartbeatIntervalMs;

    /** Tracks active emitter registrations for monitoring/cleanup. */
    private final CopyOnWriteArrayList<EmitterRegistration> activeRegistrations = new CopyOnWriteArrayList<>();

    /** Scheduler for sending periodic heartbeats to all active emitters. */
    private final ScheduledExecutorService heartbeatScheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "sse-heartbeat");
        t.setDaemon(true);
        return t;
    });

    public SseStreamingService(EventBus eventBus, EventProperties properties) {
        this.eventBus = eventBus;
        this.timeoutMs = properties.getSseTimeout().toMillis();
        this.heartbeatIntervalMs = properties.getHeartbeatInterval().toMillis();
    }

    @PostConstruct
    void startHeartbeat() {
        heartbeatScheduler.scheduleAtFixedRate(
                this::sendHeartbeats,
                heartbeatIntervalMs,
                heartbeatIntervalMs,
                TimeUnit.MILLISECONDS
        );
        log.info("SSE heartbeat scheduler started (interval={}ms)", heartbeatIntervalMs);
    }

    @PreDestroy
    void stopHeartbeat() {
        heartbeatScheduler.shutdown();
        try {
            if (!heartbeatScheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                heartbeatScheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            heartbeatScheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("SSE heartbeat scheduler stopped");
    }

    /**
     * Sends a heartbeat comment to all active emitters, and ends the streams whose
     * subscription the bus has dropped.
     */
    void sendHeartbeats() {
        if (activeRegistrations.isEmpty()) {
            return;
        }

        log.debug("Sending heartbeat to {} active SSE emitters", activeRegistrations.size());
        for (EmitterRegistration registration : activeRegistrations) {
            if (!registration.subscription.isActive()) {
                log.debug("Subscription for plan {} is no longer active; closing stream", registration.planId);
                registration.emitter.complete();
                cleanup(registration);
                continue;
            }
            try {
                registration.emitter.send(SseEmitter.event().comment("heartbeat"));
            } catch (IOException e) {
                log.debug("Heartbeat failed for plan {} (connection likely closed): {}",
                        registration.planId, e.getMessage());
                // onError/onCompletion callbacks do the cleanup
            } catch (IllegalStateException e) {
                log.debug("Heartbeat skipped for plan {} (emitter not active)", registration.planId);
            }
        }
    }

    /**
     * Creates an SSE emitter that streams events for the given plan.
     *
     * @param planId the plan to stream events for
     * @return a configured {@link SseEmitter}
     */
    public SseEmitter createEmitter(long planId) {
        SseEmitter emitter = new SseEmitter(timeoutMs);

        EventBus.Subscription subscription = eventBus.subscribe(planId, event -> sendEvent(emitter, event));

        var registration = new EmitterRegistration(planId, emitter, subscription);
        activeRegistrations.add(registration);

        emitter.onCompletion(() -> {
            log.debug("SSE emitter completed for plan {}", planId);
            cleanup(registration);
        });
        emitter.onTimeout(() -> {
            log.debug("SSE emitter timed out for plan {}", planId);
            cleanup(registration);
        });
        emitter.onError(ex -> {
            log.debug("SSE emitter error for plan {}: {}", planId, ex.getMessage());
            cleanup(registration);
        });

        // Confirms the connection before the first event
        try {
            emitter.send(SseEmitter.event().comment("connected"));
        } catch (IOException e) {
            log.warn("Failed to send initial comment for plan {}: {}", planId, e.getMessage());
        }

        log.info("SSE emitter created for plan {} (timeout={}ms)", planId, timeoutMs);
        return emitter;
    }

    /**
     * Returns the number of currently active SSE emitters.
     */
    public int activeEmitterCount() {
        return activeRegistrations.size();
    }

    private void sendEvent(SseEmitter emitter, PlanEvent event) {
        try {
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("planId", event.planId());
            if (event.path() != null) {
                data.put("path", event.path());
            }
            data.putAll(event.payload());
            data.put("timestamp", event.timestamp().toString());

            emitter.send(SseEmitter.event()
                    .name(event.eventType())
                    .data(data));
            if (PlanEvent.PLAN_DELETED.equals(event.eventType())) {
                emitter.complete();
            }
        } catch (IOException | IllegalStateException e) {
            log.debug("Failed to send SSE event {} for plan {}: {}",
                    event.eventType(), event.planId(), e.getMessage());
        }
    }

    private void cleanup(EmitterRegistration registration) {
        registration.subscription.unsubscribe();
        activeRegistrations.remove(registration);
        log.debug("Cleaned up SSE registration for plan {}", registration.planId);
    }

    private record EmitterRegistration(
            long planId,
            SseEmitter emitter,
            EventBus.Subscription subscription
    ) {}
}
