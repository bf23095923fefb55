package com.pricetracker.scraper.infrastructure.db.subscriber;

import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.BDDMockito.given;

@ExtendWith(MockitoExtension.class)
class SubscriberDirectoryAdapterTest {

    private static final UUID USER_ID = UUID.fromString("0b8e5f3a-1c2d-4e6f-8a9b-c0d1e2f3a4b5");

    @Mock
    SubscriberJpaRepository jpaRepository;

    @InjectMocks
    SubscriberDirectoryAdapter adapter;

    @Test
    void find_missingUser_returnsEmpty() {
        given(jpaRepository.findById(USER_ID)).willReturn(Optional.empty());

        assertThat(adapter.find(USER_ID)).isEmpty();
    }

    @Test
    void toSettings_noPreferences_defaultsToEmailOnly() {
        var settings = SubscriberDirectoryAdapter.toSettings(row(true, null));

        assertThat(settings.userId()).isEqualTo(USER_ID);
        assertThat(settings.email()).isEqualTo("owner@example.com");
        assertThat(settings.emailEnabled()).isTrue();
        assertThat(settings.webhookEnabled()).isFalse();
    }

    @Test
    void toSettings_webhookWithUrl_enablesWebhook() {
        var settings = SubscriberDirectoryAdapter.toSettings(row(true, Map.of(
                "email", false,
                "webhook", true,
                "webhook_url", "https://hooks.example.com/a")));

        assertThat(settings.emailEnabled()).isFalse();
        assertThat(settings.webhookEnabled()).isTrue();
        assertThat(settings.webhookUrl()).isEqualTo("https://hooks.example.com/a");
    }

    @Test
    void toSettings_webhookWithoutUrl_staysDisabled() {
        var settings = SubscriberDirectoryAdapter.toSettings(row(true, Map.of("webhook", true, "webhook_url", "")));

        assertThat(settings.webhookEnabled()).isFalse();
        assertThat(settings.webhookUrl()).isNull();
    }

    @Test
    void toSettings_inactiveUser_hasNoChannels() {
        var settings = SubscriberDirectoryAdapter.toSettings(row(false, Map.of(
                "webhook", true,
                "webhook_url", "https://hooks.example.com/a")));

        assertThat(settings.emailEnabled()).isFalse();
        assertThat(settings.webhookEnabled()).isFalse();
    }

    private static SubscriberRow row(boolean active, Map<String, Object> preferences) {
        return SubscriberRow.builder()
                .id(USER_ID)
                .email("owner@example.com")
                .active(active)
                .notificationSettings(preferences)
                .build();
    }
}
