package com.scatterbrain.core.events;

import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * In-memory pub/sub for plan change events.
 * <p>
 * Supports per-plan subscriptions and global subscriptions that receive all events. Every
 * subscriber owns a bounded queue drained on the delivery executor, so {@link #publish} only
 * enqueues and never waits on a consumer. A subscriber whose queue is full is closed and
 * pruned; events for one subscriber arrive in publish order.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    /** Per-plan subscribers keyed by planId. */
    private final ConcurrentHashMap<Long, CopyOnWriteArrayList<Subscriber>> planSubscribers =
            new ConcurrentHashMap<>();

    /** Global subscribers that receive events from all plans. */
    private final CopyOnWriteArrayList<Subscriber> globalSubscribers = new CopyOnWriteArrayList<>();

    private final Executor deliveryExecutor;
    private final ExecutorService ownedExecutor;
    private final int subscriberCapacity;
    private final AtomicLong droppedSubscribers = new AtomicLong();

    @Autowired
    public EventBus(EventProperties properties) {
        this(newDeliveryExecutor(), properties.getSubscriberCapacity());
    }

    /**
     * @param deliveryExecutor runs subscriber drain loops; a direct executor makes delivery synchronous
     * @param subscriberCapacity queue bound per subscriber
     */
    public EventBus(Executor deliveryExecutor, int subscriberCapacity) {
        if (subscriberCapacity < 1) {
            throw new IllegalArgumentException("subscriberCapacity must be positive: " + subscriberCapacity);
        }
        this.deliveryExecutor = deliveryExecutor;
        this.ownedExecutor = deliveryExecutor instanceof ExecutorService es ? es : null;
        this.subscriberCapacity = subscriberCapacity;
    }

    private static ExecutorService newDeliveryExecutor() {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "event-delivery-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @PreDestroy
    void shutdown() {
        if (ownedExecutor != null) {
            ownedExecutor.shutdownNow();
        }
    }

    /**
     * Publish an event to all matching subscribers (plan-specific and global).
     *
     * @param event the event to publish
     */
    public void publish(PlanEvent event) {
        log.debug("Publishing event: {} for plan {}", event.eventType(), event.planId());

        List<Subscriber> planSubs = planSubscribers.get(event.planId());
        if (planSubs != null) {
            offerAll(planSubs, event);
        }
        offerAll(globalSubscribers, event);
    }

    /**
     * Subscribe to events for a specific plan.
     *
     * @param planId   the plan to subscribe to
     * @param consumer callback invoked for each event, on a delivery thread
     * @return a {@link Subscription} handle to unsubscribe later
     */
    public Subscription subscribe(long planId, Consumer<PlanEvent> consumer) {
        CopyOnWriteArrayList<Subscriber> subs =
                planSubscribers.computeIfAbsent(planId, k -> new CopyOnWriteArrayList<>());
        Subscriber subscriber = new Subscriber("plan " + planId, consumer);
        subs.add(subscriber);
        log.debug("Subscribed to plan {}", planId);
        return subscriber.handle(subs);
    }

    /**
     * Subscribe to events from all plans (global subscription).
     *
     * @param consumer callback invoked for each event regardless of plan
     * @return a {@link Subscription} handle to unsubscribe later
     */
    public Subscription subscribeAll(Consumer<PlanEvent> consumer) {
        Subscriber subscriber = new Subscriber("global", consumer);
        globalSubscribers.add(subscriber);
        log.debug("Subscribed to all events (global)");
        return subscriber.handle(globalSubscribers);
    }

    /**
     * Drops the topic of a deleted plan. Its subscribers are closed after whatever is already
     * queued for them has been delivered.
     */
    public void removeTopic(long planId) {
        List<Subscriber> subs = planSubscribers.remove(planId);
        if (subs != null) {
            subs.forEach(Subscriber::closeWhenDrained);
            log.debug("Removed topic for plan {} ({} subscribers)", planId, subs.size());
        }
    }

    public int subscriberCount(long planId) {
        List<Subscriber> subs = planSubscribers.get(planId);
        return subs == null ? 0 : subs.size();
    }

    /** Number of subscribers dropped so far because their queue overflowed. */
    public long droppedSubscriberCount() {
        return droppedSubscribers.get();
    }

    /**
     * Handle for cancelling a subscription.
     */
    public interface Subscription {

        void unsubscribe();

        /** False once unsubscribed or dropped for falling behind. */
        boolean isActive();
    }

    private void offerAll(List<Subscriber> subscribers, PlanEvent event) {
        for (Subscriber subscriber : subscribers) {
            if (!subscriber.offer(event)) {
                subscribers.remove(subscriber);
                if (subscriber.overflowed) {
                    droppedSubscribers.incrementAndGet();
                    log.warn("Dropped slow {} subscriber: {} undelivered events queued",
                            subscriber.scope, subscriberCapacity);
                }
            }
        }
    }

    private void deliverSafely(Consumer<PlanEvent> consumer, PlanEvent event) {
        try {
            consumer.accept(event);
        } catch (Exception e) {
            log.warn("Subscriber threw exception processing event {}: {}",
                    event.eventType(), e.getMessage(), e);
        }
    }

    private final class Subscriber {

        private final String scope;
        private final Consumer<PlanEvent> consumer;
        private final BlockingQueue<PlanEvent> queue;
        private final AtomicBoolean draining = new AtomicBoolean();
        private volatile boolean closed;
        private volatile boolean closeWhenDrained;
        private volatile boolean overflowed;

        Subscriber(String scope, Consumer<PlanEvent> consumer) {
            this.scope = scope;
            this.consumer = consumer;
            this.queue = new ArrayBlockingQueue<>(subscriberCapacity);
        }

        Subscription handle(List<Subscriber> owner) {
            return new Subscription() {
                @Override
                public void unsubscribe() {
                    closed = true;
                    queue.clear();
                    owner.remove(Subscriber.this);
                }

                @Override
                public boolean isActive() {
                    return !closed;
                }
            };
        }

        boolean offer(PlanEvent event) {
            if (closed) {
                return false;
            }
            if (!queue.offer(event)) {
                overflowed = true;
                closed = true;
                queue.clear();
                return false;
            }
            scheduleDrain();
            return true;
        }

        void closeWhenDrained() {
            closeWhenDrained = true;
            if (queue.isEmpty()) {
                closed = true;
            }
        }

        private void scheduleDrain() {
            if (draining.compareAndSet(false, true)) {
                try {
                    deliveryExecutor.execute(this::drain);
                } catch (RejectedExecutionException e) {
                    draining.set(false);
                    closed = true;
                    log.warn("Event delivery rejected for {} subscriber; closing it", scope);
                }
            }
        }

        private void drain() {
            try {
                PlanEvent event;
                while (!closed && (event = queue.poll()) != null) {
                    deliverSafely(consumer, event);
                }
            } finally {
                draining.set(false);
            }
            if (closeWhenDrained && queue.isEmpty()) {
                closed = true;
            } else if (!closed && !queue.isEmpty()) {
                scheduleDrain();
            }
        }
    }
}
