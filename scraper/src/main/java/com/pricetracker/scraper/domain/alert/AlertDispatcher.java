package com.pricetracker.scraper.domain.alert;

import io.micrometer.core.instrument.Counter;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Persists a fired alert and delivers it over every channel the subscriber enabled.
 *
 * <p>Channels run concurrently on {@code dispatchExecutor}, each bounded by the channel timeout.
 * One accepting channel is enough for the alert to count as delivered; otherwise every
 * channel's reason is kept in the error summary. Nothing is retried.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AlertDispatcher {

    static final String NO_CHANNELS = "no channels enabled";
    static final String UNKNOWN_SUBSCRIBER = "subscriber not found";

    private final AlertEventStore eventStore;
    private final SubscriberDirectory subscriberDirectory;
    private final List<NotificationChannel> channels;
    private final AlertCounter alertCounter;
    private final AlertSettings alertSettings;
    private final Executor dispatchExecutor;
    private final Clock clock;
    private final Counter alertsDeliveredCounter;
    private final Counter alertsFailedCounter;

    public DeliveryResult dispatch(AlertNotification notification) {
        var alertId = eventStore.createAlert(notification.event());
        var persisted = notification.withEvent(notification.event().toBuilder().id(alertId).build());

        var subscriber = subscriberDirectory.find(persisted.event().subscriberId());
        if (subscriber.isEmpty()) {
            return fail(persisted, Map.of(), UNKNOWN_SUBSCRIBER);
        }

        var enabled = channels.stream()
                .filter(channel -> channel.isEnabledFor(subscriber.get()))
                .toList();
        if (enabled.isEmpty()) {
            return fail(persisted, Map.of(), NO_CHANNELS);
        }

        var outcomes = deliver(persisted, subscriber.get(), enabled);
        var deliveredVia = new ArrayList<String>();
        var failures = new LinkedHashMap<String, String>();
        outcomes.forEach((type, error) -> {
            if (error == null) {
                deliveredVia.add(type);
            } else {
                failures.put(type, error);
            }
        });

        if (deliveredVia.isEmpty()) {
            var summary = failures.entrySet().stream()
                    .map(entry -> entry.getKey() + ": " + entry.getValue())
                    .collect(Collectors.joining("; "));
            return fail(persisted, failures, summary);
        }

        eventStore.markDelivered(alertId, String.join(",", deliveredVia), clock.instant());
        alertCounter.recordSent(persisted.event());
        alertsDeliveredCounter.increment();
        if (!failures.isEmpty()) {
            log.warn("Alert {} delivered via {} but failed on {}", alertId, deliveredVia, failures);
        } else {
            log.info(
                    "Alert {} ({}) for item {} delivered via {}",
                    alertId,
                    persisted.event().kind(),
                    persisted.event().itemId(),
                    deliveredVia);
        }
        return new DeliveryResult(alertId, DeliveryStatus.SENT, List.copyOf(deliveredVia), Map.copyOf(failures));
    }

    /**
     * @return channel type to failure reason, or to null when the channel accepted the alert
     */
    private Map<String, String> deliver(
            AlertNotification notification, SubscriberSettings subscriber, List<NotificationChannel> enabled) {
        var timeout = alertSettings.channelTimeout();
        Map<String, CompletableFuture<String>> pending = new LinkedHashMap<>();
        for (var channel : enabled) {
            var future = CompletableFuture
                    .runAsync(() -> channel.send(notification, subscriber), dispatchExecutor)
                    .orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS)
                    .handle((ignored, error) -> error == null ? null : describe(error, timeout.toSeconds()));
            pending.put(channel.type(), future);
        }

        Map<String, String> outcomes = new LinkedHashMap<>();
        pending.forEach((type, future) -> outcomes.put(type, future.join()));
        return outcomes;
    }

    private static String describe(Throwable error, long timeoutSeconds) {
        var cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
        if (cause instanceof TimeoutException) {
            return "timed out after " + timeoutSeconds + "s";
        }
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }

    private DeliveryResult fail(AlertNotification notification, Map<String, String> failures, String summary) {
        var alertId = notification.event().id();
        eventStore.markFailed(alertId, summary);
        alertsFailedCounter.increment();
        log.warn("Alert {} for item {} not delivered: {}", alertId, notification.event().itemId(), summary);
        return new DeliveryResult(alertId, DeliveryStatus.FAILED, List.of(), Map.copyOf(failures));
    }
}
