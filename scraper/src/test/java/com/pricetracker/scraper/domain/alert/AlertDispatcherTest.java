package com.pricetracker.scraper.domain.alert;

import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.mockito.BDDMockito.then;
import static org.mockito.Mockito.never;

class AlertDispatcherTest extends AlertDispatcherBaseTest {

    @Test
    void oneChannelTimesOutAndOneSucceeds_markedDeliveredViaSucceedingChannel() {
        // given
        given(eventStore.createAlert(any())).willReturn(ALERT_ID);
        given(subscriberDirectory.find(any())).willReturn(Optional.of(BOTH_CHANNELS));
        var dispatcher = dispatcher(hanging("webhook"), accepting("email"));

        // when
        var result = dispatcher.dispatch(dropNotification());

        // then
        assertThat(result.delivered()).isTrue();
        assertThat(result.alertId()).isEqualTo(ALERT_ID);
        assertThat(result.deliveredVia()).containsExactly("email");
        assertThat(result.failures()).containsOnlyKeys("webhook");
        assertThat(result.failures().get("webhook")).startsWith("timed out");
        then(eventStore).should().markDelivered(ALERT_ID, "email", NOW);
        then(eventStore).should(never()).markFailed(any(), anyString());
        assertThat(deliveredCounter.count()).isEqualTo(1.0);
        assertThat(failedCounter.count()).isZero();
    }

    @Test
    void bothChannelsFail_markedFailedWithBothReasons() {
        // given
        given(eventStore.createAlert(any())).willReturn(ALERT_ID);
        given(subscriberDirectory.find(any())).willReturn(Optional.of(BOTH_CHANNELS));
        var dispatcher = dispatcher(rejecting("email", "SMTP 550 mailbox unavailable"), hanging("webhook"));

        // when
        var result = dispatcher.dispatch(dropNotification());

        // then
        assertThat(result.status()).isEqualTo(DeliveryStatus.FAILED);
        assertThat(result.failures()).containsOnlyKeys("email", "webhook");

        var summary = ArgumentCaptor.forClass(String.class);
        then(eventStore).should().markFailed(eq(ALERT_ID), summary.capture());
        assertThat(summary.getValue())
                .contains("email: email delivery failed: SMTP 550 mailbox unavailable")
                .contains("webhook: timed out");
        then(eventStore).should(never()).markDelivered(any(), anyString(), any());
        then(alertCounter).shouldHaveNoInteractions();
        assertThat(failedCounter.count()).isEqualTo(1.0);
    }

    @Test
    void allChannelsSucceed_recordsEveryMethodAndCounts() {
        // given
        given(eventStore.createAlert(any())).willReturn(ALERT_ID);
        given(subscriberDirectory.find(any())).willReturn(Optional.of(BOTH_CHANNELS));
        var dispatcher = dispatcher(accepting("email"), accepting("webhook"));

        // when
        var result = dispatcher.dispatch(dropNotification());

        // then
        assertThat(result.deliveredVia()).containsExactly("email", "webhook");
        then(eventStore).should().markDelivered(ALERT_ID, "email,webhook", NOW);
        var sent = ArgumentCaptor.forClass(AlertEvent.class);
        then(alertCounter).should().recordSent(sent.capture());
        assertThat(sent.getValue().id()).isEqualTo(ALERT_ID);
    }

    @Test
    void noEnabledChannel_markedFailed() {
        // given
        given(eventStore.createAlert(any())).willReturn(ALERT_ID);
        given(subscriberDirectory.find(any())).willReturn(Optional.of(BOTH_CHANNELS));
        var email = disabled("email");
        var dispatcher = dispatcher(email);

        // when
        var result = dispatcher.dispatch(dropNotification());

        // then
        assertThat(result.status()).isEqualTo(DeliveryStatus.FAILED);
        then(eventStore).should().markFailed(ALERT_ID, AlertDispatcher.NO_CHANNELS);
        assertThat(((StubChannel) email).sends).isZero();
    }

    @Test
    void unknownSubscriber_markedFailed() {
        // given
        given(eventStore.createAlert(any())).willReturn(ALERT_ID);
        given(subscriberDirectory.find(any())).willReturn(Optional.empty());

        // when
        var result = dispatcher(accepting("email")).dispatch(dropNotification());

        // then
        assertThat(result.delivered()).isFalse();
        then(eventStore).should().markFailed(ALERT_ID, AlertDispatcher.UNKNOWN_SUBSCRIBER);
    }

    @Test
    void eventIsPersistedBeforeAnyChannelRuns() {
        // given
        given(eventStore.createAlert(any())).willReturn(ALERT_ID);
        given(subscriberDirectory.find(any())).willReturn(Optional.of(BOTH_CHANNELS));

        // when
        dispatcher(accepting("email")).dispatch(dropNotification());

        // then
        var created = ArgumentCaptor.forClass(AlertEvent.class);
        then(eventStore).should().createAlert(created.capture());
        assertThat(created.getValue().id()).isNull();
        assertThat(created.getValue().deliveryStatus()).isEqualTo(DeliveryStatus.PENDING);
    }
}
