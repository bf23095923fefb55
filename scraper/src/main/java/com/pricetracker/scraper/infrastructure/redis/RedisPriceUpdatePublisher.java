package com.pricetracker.scraper.infrastructure.redis;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pricetracker.common.event.PriceUpdate;
import com.pricetracker.common.json.JacksonConfig;
import com.pricetracker.scraper.domain.tracking.PriceUpdatePublisher;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@ConditionalOnProperty(prefix = "scraper.redis", name = "enabled", havingValue = "true", matchIfMissing = true)
public class RedisPriceUpdatePublisher implements PriceUpdatePublisher {

    private static final ObjectMapper MAPPER = JacksonConfig.createObjectMapper();

    private final StringRedisTemplate redisTemplate;

    public RedisPriceUpdatePublisher(StringRedisTemplate redisTemplate) {
        this.redisTemplate = redisTemplate;
    }

    @Override
    public void publish(PriceUpdate update) {
        try {
            redisTemplate.convertAndSend(PriceUpdate.channelFor(update.productId()), MAPPER.writeValueAsString(update));
        } catch (JsonProcessingException e) {
            log.error("Could not serialize price update for item {}", update.productId(), e);
        } catch (DataAccessException e) {
            log.warn("Could not publish price update for item {}: {}", update.productId(), e.getMessage());
        }
    }
}
