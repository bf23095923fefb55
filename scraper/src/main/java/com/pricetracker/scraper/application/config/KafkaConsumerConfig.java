package com.pricetracker.scraper.application.config;

import com.pricetracker.common.event.ScrapeRequest;
import java.util.HashMap;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.common.serialization.StringDeserializer;
import org.springframework.boot.autoconfigure.kafka.KafkaProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.ConcurrentKafkaListenerContainerFactory;
import org.springframework.kafka.core.ConsumerFactory;
import org.springframework.kafka.core.DefaultKafkaConsumerFactory;
import org.springframework.kafka.listener.ContainerProperties;
import org.springframework.kafka.support.serializer.JsonDeserializer;

@Configuration
public class KafkaConsumerConfig {

    static final String SCRAPE_REQUESTS_GROUP = "scraper-requests";

    @Bean
    public ConcurrentKafkaListenerContainerFactory<String, ScrapeRequest>
            scrapeRequestListenerContainerFactory(KafkaProperties kafkaProperties) {
        var factory = new ConcurrentKafkaListenerContainerFactory<String, ScrapeRequest>();
        factory.setConsumerFactory(consumerFactory(kafkaProperties, ScrapeRequest.class, SCRAPE_REQUESTS_GROUP));
        factory.getContainerProperties().setAckMode(ContainerProperties.AckMode.RECORD);
        // Listener threads only enqueue; the scrape itself runs on the orchestrator's workers.
        factory.setConcurrency(2);
        return factory;
    }

    private <T> ConsumerFactory<String, T> consumerFactory(
            KafkaProperties kafkaProperties, Class<T> valueType, String groupId) {
        var props = new HashMap<String, Object>();
        props.put(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG, kafkaProperties.getBootstrapServers());
        props.put(ConsumerConfig.GROUP_ID_CONFIG, groupId);
        props.put(
                ConsumerConfig.AUTO_OFFSET_RESET_CONFIG,
                kafkaProperties.getConsumer().getAutoOffsetReset());
        props.put(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG, false);

        var deserializer = new JsonDeserializer<>(valueType, false);
        deserializer.addTrustedPackages("com.pricetracker.common.*");

        return new DefaultKafkaConsumerFactory<>(props, new StringDeserializer(), deserializer);
    }
}
