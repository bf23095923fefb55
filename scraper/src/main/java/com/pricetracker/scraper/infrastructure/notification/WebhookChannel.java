package com.pricetracker.scraper.infrastructure.notification;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pricetracker.common.json.JacksonConfig;
import com.pricetracker.scraper.domain.alert.AlertNotification;
import com.pricetracker.scraper.domain.alert.NotificationChannel;
import com.pricetracker.scraper.domain.alert.SubscriberSettings;
import com.pricetracker.scraper.domain.exceptions.ChannelDeliveryException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

/**
 * POSTs the alert as JSON to the subscriber's webhook URL. Any 4xx or 5xx response fails the delivery.
 */
@Slf4j
@Component
public class WebhookChannel implements NotificationChannel {

    public static final String TYPE = "webhook";

    private static final ObjectMapper MAPPER = JacksonConfig.createObjectMapper();

    private final RestClient restClient;

    public WebhookChannel(@Qualifier("webhookRestClient") RestClient restClient) {
        this.restClient = restClient;
    }

    @Override
    public String type() {
        return TYPE;
    }

    @Override
    public boolean isEnabledFor(SubscriberSettings subscriber) {
        return subscriber.webhookEnabled() && subscriber.webhookUrl() != null && !subscriber.webhookUrl().isBlank();
    }

    @Override
    public void send(AlertNotification notification, SubscriberSettings subscriber) {
        var alertId = notification.event().id();
        try {
            restClient.post()
                    .uri(subscriber.webhookUrl())
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(MAPPER.writeValueAsString(WebhookPayload.of(notification)))
                    .retrieve()
                    .toBodilessEntity();
            log.info("Webhook sent for alert {}", alertId);
        } catch (RestClientResponseException e) {
            throw ChannelDeliveryException.of(TYPE, "webhook returned " + e.getStatusCode().value());
        } catch (RestClientException | JsonProcessingException | IllegalArgumentException e) {
            throw ChannelDeliveryException.of(TYPE, e);
        }
    }
}
