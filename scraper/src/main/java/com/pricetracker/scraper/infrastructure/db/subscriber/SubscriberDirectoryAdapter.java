package com.pricetracker.scraper.infrastructure.db.subscriber;

import com.pricetracker.scraper.domain.alert.SubscriberDirectory;
import com.pricetracker.scraper.domain.alert.SubscriberSettings;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Missing preference keys fall back to email on, webhook off. Inactive users get no channels.
 */
@Repository
@RequiredArgsConstructor
public class SubscriberDirectoryAdapter implements SubscriberDirectory {

    private final SubscriberJpaRepository jpaRepository;

    @Override
    @Transactional(readOnly = true)
    public Optional<SubscriberSettings> find(UUID userId) {
        return jpaRepository.findById(userId).map(SubscriberDirectoryAdapter::toSettings);
    }

    static SubscriberSettings toSettings(SubscriberRow row) {
        Map<String, Object> settings = row.getNotificationSettings() != null ? row.getNotificationSettings() : Map.of();
        var webhookUrl = settings.get("webhook_url") instanceof String url && !url.isBlank() ? url : null;
        return SubscriberSettings.builder()
                .userId(row.getId())
                .email(row.getEmail())
                .emailEnabled(row.isActive() && flag(settings, "email", true))
                .webhookEnabled(row.isActive() && flag(settings, "webhook", false) && webhookUrl != null)
                .webhookUrl(webhookUrl)
                .build();
    }

    private static boolean flag(Map<String, Object> settings, String key, boolean fallback) {
        var value = settings.get(key);
        return value instanceof Boolean enabled ? enabled : fallback;
    }
}
