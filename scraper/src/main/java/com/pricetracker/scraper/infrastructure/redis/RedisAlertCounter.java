package com.pricetracker.scraper.infrastructure.redis;

import com.pricetracker.scraper.domain.alert.AlertCounter;
import com.pricetracker.scraper.domain.alert.AlertEvent;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

/**
 * {@code alerts:sent:<date>} holds one field per alert kind and lives for a week.
 * {@code user:alerts:<userId>} keeps a running total per subscriber.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "scraper.redis", name = "enabled", havingValue = "true", matchIfMissing = true)
public class RedisAlertCounter implements AlertCounter {

    static final Duration DAILY_RETENTION = Duration.ofDays(7);

    private final StringRedisTemplate redisTemplate;
    private final Clock clock;

    @Override
    public void recordSent(AlertEvent event) {
        var dailyKey = "alerts:sent:" + LocalDate.now(clock);
        try {
            redisTemplate.opsForHash().increment(dailyKey, event.kind().name(), 1);
            redisTemplate.expire(dailyKey, DAILY_RETENTION);
            redisTemplate.opsForHash().increment("user:alerts:" + event.subscriberId(), "total", 1);
        } catch (DataAccessException e) {
            log.warn("Could not update alert counters for alert {}: {}", event.id(), e.getMessage());
        }
    }
}
