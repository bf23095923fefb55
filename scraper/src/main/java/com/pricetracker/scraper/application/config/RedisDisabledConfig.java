package com.pricetracker.scraper.application.config;

import com.pricetracker.scraper.domain.alert.AlertCounter;
import com.pricetracker.scraper.domain.proxy.ProxyStatusPublisher;
import com.pricetracker.scraper.domain.tracking.PriceUpdatePublisher;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Stand-ins for the Redis side channels when {@code scraper.redis.enabled=false}.
 */
@Slf4j
@Configuration
@ConditionalOnProperty(prefix = "scraper.redis", name = "enabled", havingValue = "false")
public class RedisDisabledConfig {

    @Bean
    public PriceUpdatePublisher priceUpdatePublisher() {
        log.info("Redis disabled: price updates will not be published");
        return update -> log.debug("Price update for item {} not published", update.productId());
    }

    @Bean
    public AlertCounter alertCounter() {
        return event -> { };
    }

    @Bean
    public ProxyStatusPublisher proxyStatusPublisher() {
        return healthy -> log.debug("{} healthy proxies not published", healthy.size());
    }
}
