package com.pricetracker.scraper.infrastructure.notification;

import com.pricetracker.common.event.AlertKind;
import com.pricetracker.scraper.domain.exceptions.ChannelDeliveryException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import static com.pricetracker.scraper.infrastructure.notification.NotificationFixtures.WEBHOOK_URL;
import static com.pricetracker.scraper.infrastructure.notification.NotificationFixtures.notification;
import static com.pricetracker.scraper.infrastructure.notification.NotificationFixtures.subscriber;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.content;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class WebhookChannelTest {

    private MockRestServiceServer server;
    private WebhookChannel channel;

    @BeforeEach
    void setUp() {
        var builder = RestClient.builder();
        server = MockRestServiceServer.bindTo(builder).build();
        channel = new WebhookChannel(builder.build());
    }

    @Test
    void send_postsAlertPayload() {
        server.expect(requestTo(WEBHOOK_URL))
                .andExpect(method(HttpMethod.POST))
                .andExpect(content().contentTypeCompatibleWith(MediaType.APPLICATION_JSON))
                .andExpect(jsonPath("$.event").value("price_alert"))
                .andExpect(jsonPath("$.alert_type").value("PRICE_DROP"))
                .andExpect(jsonPath("$.product.title").value("Echo Dot (4th Gen)"))
                .andExpect(jsonPath("$.product.marketplace").value("AMAZON"))
                .andExpect(jsonPath("$.product.current_price").value(85.0))
                .andExpect(jsonPath("$.product.currency").value("USD"))
                .andExpect(jsonPath("$.price_change.old_price").value(100.0))
                .andExpect(jsonPath("$.price_change.new_price").value(85.0))
                .andExpect(jsonPath("$.price_change.change_percent").value(-15.0))
                .andExpect(jsonPath("$.price_change.savings").value(15.0))
                .andExpect(jsonPath("$.timestamp").value("2026-03-02T10:00:05Z"))
                .andRespond(withSuccess());

        channel.send(notification(AlertKind.PRICE_DROP, "Echo Dot (4th Gen)"), subscriber());

        server.verify();
    }

    @Test
    void send_serverError_failsDelivery() {
        server.expect(requestTo(WEBHOOK_URL)).andRespond(withServerError());

        assertThatThrownBy(() -> channel.send(notification(AlertKind.NEW_LOW, "Lamp"), subscriber()))
                .isInstanceOf(ChannelDeliveryException.class)
                .hasMessageContaining("webhook returned 500");
    }

    @Test
    void send_clientError_failsDelivery() {
        server.expect(requestTo(WEBHOOK_URL)).andRespond(withStatus(HttpStatus.GONE));

        assertThatThrownBy(() -> channel.send(notification(AlertKind.NEW_LOW, "Lamp"), subscriber()))
                .isInstanceOf(ChannelDeliveryException.class)
                .hasMessageContaining("410");
    }

    @Test
    void isEnabledFor_requiresFlagAndUrl() {
        assertThat(channel.isEnabledFor(subscriber())).isTrue();
        assertThat(channel.isEnabledFor(subscriber().toBuilder().webhookEnabled(false).build())).isFalse();
        assertThat(channel.isEnabledFor(subscriber().toBuilder().webhookUrl(" ").build())).isFalse();
    }
}
