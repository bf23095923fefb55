package com.pricetracker.scraper.infrastructure.redis;

import com.pricetracker.scraper.domain.proxy.ProxyEndpoint;
import com.pricetracker.scraper.domain.proxy.ProxyStatusPublisher;
import java.time.Duration;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

/**
 * Replaces the {@code proxy:healthy} set after each sweep. Members never carry credentials.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "scraper.redis", name = "enabled", havingValue = "true", matchIfMissing = true)
public class RedisProxyStatusPublisher implements ProxyStatusPublisher {

    static final String HEALTHY_KEY = "proxy:healthy";
    static final Duration TTL = Duration.ofMinutes(10);

    private final StringRedisTemplate redisTemplate;

    @Override
    public void publishHealthy(List<ProxyEndpoint> healthy) {
        try {
            redisTemplate.delete(HEALTHY_KEY);
            if (healthy.isEmpty()) {
                return;
            }
            var members = healthy.stream().map(ProxyEndpoint::address).toArray(String[]::new);
            redisTemplate.opsForSet().add(HEALTHY_KEY, members);
            redisTemplate.expire(HEALTHY_KEY, TTL);
        } catch (DataAccessException e) {
            log.warn("Could not publish healthy proxies: {}", e.getMessage());
        }
    }
}
