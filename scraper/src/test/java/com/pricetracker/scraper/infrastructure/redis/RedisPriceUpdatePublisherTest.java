package com.pricetracker.scraper.infrastructure.redis;

import com.pricetracker.common.event.PriceUpdate;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.StringRedisTemplate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatNoException;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.mockito.BDDMockito.then;

@ExtendWith(MockitoExtension.class)
class RedisPriceUpdatePublisherTest {

    private static final UUID ITEM_ID = UUID.fromString("6f1c1a52-7d4e-4d5b-9a59-3b2f0c1d2e01");

    @Mock
    StringRedisTemplate redisTemplate;

    @InjectMocks
    RedisPriceUpdatePublisher publisher;

    @Test
    void publish_sendsJsonOnItemChannel() {
        // when
        publisher.publish(update());

        // then
        var payload = ArgumentCaptor.forClass(Object.class);
        then(redisTemplate).should().convertAndSend(eq("price_update:" + ITEM_ID), payload.capture());
        assertThat((String) payload.getValue())
                .contains("\"product_id\":\"" + ITEM_ID + "\"")
                .contains("\"new_price\":85.00")
                .contains("\"in_stock\":true")
                .contains("\"timestamp\":\"2026-03-02T10:00:05Z\"");
    }

    @Test
    void publish_redisDown_doesNotPropagate() {
        // given
        given(redisTemplate.convertAndSend(anyString(), any())).willThrow(new RedisConnectionFailureException("down"));

        // when / then
        assertThatNoException().isThrownBy(() -> publisher.publish(update()));
    }

    private static PriceUpdate update() {
        return PriceUpdate.builder()
                .productId(ITEM_ID)
                .oldPrice(new BigDecimal("100.00"))
                .newPrice(new BigDecimal("85.00"))
                .currency("USD")
                .inStock(true)
                .changePercent(new BigDecimal("-15.00"))
                .timestamp(Instant.parse("2026-03-02T10:00:05Z"))
                .build();
    }
}
