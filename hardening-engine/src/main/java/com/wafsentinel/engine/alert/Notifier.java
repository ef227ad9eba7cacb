package com.wafsentinel.engine.alert;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Best-effort fan-out of notifications to every configured channel.
 *
 * <p>
 * Each channel is isolated: a failing channel is counted and logged, the
 * others still receive the event, and nothing is thrown back to the caller.
 * </p>
 *
 * @author WAF Sentinel Team
 */
public class Notifier {

    private static final Logger log = LoggerFactory.getLogger(Notifier.class);

    private final List<NotificationChannel> channels;
    private final MeterRegistry meterRegistry;

    private Counter notificationsSent;
    private Counter notificationsFailed;

    public Notifier(List<NotificationChannel> channels, MeterRegistry meterRegistry) {
        this.channels = List.copyOf(channels);
        this.meterRegistry = meterRegistry;
    }

    @PostConstruct
    public void init() {
        notificationsSent = Counter.builder("sentinel.notification.sent")
                .description("Notifications delivered to a channel")
                .register(meterRegistry);
        notificationsFailed = Counter.builder("sentinel.notification.failed")
                .description("Notification delivery failures")
                .register(meterRegistry);

        log.info("Notifier initialized with {} channel(s): {}",
                channels.size(), channels.stream().map(NotificationChannel::name).toList());
    }

    public void notify(NotificationEvent event) {
        log.info("Notification {} [{}]: {}", event.kind().getDisplayName(), event.severity(), event.subject());
        for (NotificationChannel channel : channels) {
            try {
                channel.send(event);
                notificationsSent.increment();
            } catch (RuntimeException e) {
                notificationsFailed.increment();
                log.error("Notification {} not delivered via {}: {}",
                        event.eventId(), channel.name(), e.getMessage());
            }
        }
    }
}
