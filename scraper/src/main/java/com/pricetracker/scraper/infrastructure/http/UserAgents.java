package com.pricetracker.scraper.infrastructure.http;

import com.pricetracker.scraper.application.config.ScraperProperties;
import java.util.List;
import java.util.concurrent.ThreadLocalRandom;
import org.springframework.stereotype.Component;

@Component
public class UserAgents {

    private final List<String> agents;

    public UserAgents(ScraperProperties properties) {
        this.agents = List.copyOf(properties.fetch().userAgents());
    }

    public String next() {
        return agents.get(ThreadLocalRandom.current().nextInt(agents.size()));
    }
}
