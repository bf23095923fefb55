package com.pricetracker.scraper.infrastructure.http;

import com.pricetracker.scraper.application.config.ScraperProperties;
import com.pricetracker.scraper.domain.extraction.PageTransport;
import com.pricetracker.scraper.domain.extraction.PageTransportFactory;
import com.pricetracker.scraper.domain.proxy.ProxyEndpoint;
import org.springframework.stereotype.Component;

@Component
public class JdkPageTransportFactory implements PageTransportFactory {

    private final ProxiedHttpClients clients;
    private final UserAgents userAgents;
    private final ScraperProperties properties;

    public JdkPageTransportFactory(ProxiedHttpClients clients, UserAgents userAgents, ScraperProperties properties) {
        this.clients = clients;
        this.userAgents = userAgents;
        this.properties = properties;
    }

    @Override
    public PageTransport forEndpoint(ProxyEndpoint endpoint) {
        return new JdkPageTransport(
                clients.clientFor(endpoint), userAgents.next(), properties.fetch().requestTimeout());
    }
}
