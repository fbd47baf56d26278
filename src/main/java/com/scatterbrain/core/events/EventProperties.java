package com.scatterbrain.core.events;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Change-notification settings.
 *
 * <pre>
 * scatterbrain:
 *   events:
 *     subscriber-capacity: 100
 *     sse-timeout: 30m
 *     heartbeat-interval: 30s
 * </pre>
 */
@Component
@ConfigurationProperties(prefix = "scatterbrain.events")
public class EventProperties {

    /** Events a single subscriber may have queued before it is dropped. */
    private int subscriberCapacity = 100;

    private Duration sseTimeout = Duration.ofMinutes(30);

    private Duration heartbeatInterval = Duration.ofSeconds(30);

    public int getSubscriberCapacity() { return subscriberCapacity; }
    public void setSubscriberCapacity(int subscriberCapacity) { this.subscriberCapacity = subscriberCapacity; }
    public Duration getSseTimeout() { return sseTimeout; }
    public void setSseTimeout(Duration sseTimeout) { this.sseTimeout = sseTimeout; }
    public Duration getHeartbeatInterval() { return heartbeatInterval; }
    public void setHeartbeatInterval(Duration heartbeatInterval) { this.heartbeatInterval = heartbeatInterval; }
}
