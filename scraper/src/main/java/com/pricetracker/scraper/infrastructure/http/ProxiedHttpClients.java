package com.pricetracker.scraper.infrastructure.http;

import com.pricetracker.scraper.application.config.ScraperProperties;
import com.pricetracker.scraper.domain.proxy.ProxyEndpoint;
import java.net.Authenticator;
import java.net.InetSocketAddress;
import java.net.PasswordAuthentication;
import java.net.ProxySelector;
import java.net.http.HttpClient;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.springframework.stereotype.Component;

/**
 * One {@link HttpClient} per proxy endpoint, built lazily and reused so connections to the
 * proxy are pooled.
 */
@Component
public class ProxiedHttpClients {

    private final Map<ProxyEndpoint, HttpClient> clients = new ConcurrentHashMap<>();
    private final Duration connectTimeout;

    public ProxiedHttpClients(ScraperProperties properties) {
        this.connectTimeout = properties.fetch().connectTimeout();
    }

    public HttpClient clientFor(ProxyEndpoint endpoint) {
        return clients.computeIfAbsent(endpoint, this::create);
    }

    private HttpClient create(ProxyEndpoint endpoint) {
        var builder = HttpClient.newBuilder()
                .connectTimeout(connectTimeout)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .proxy(ProxySelector.of(new InetSocketAddress(endpoint.host(), endpoint.port())));
        if (endpoint.hasCredentials()) {
            builder.authenticator(new ProxyAuthenticator(endpoint));
        }
        return builder.build();
    }

    private static final class ProxyAuthenticator extends Authenticator {

        private final ProxyEndpoint endpoint;

        private ProxyAuthenticator(ProxyEndpoint endpoint) {
            this.endpoint = endpoint;
        }

        @Override
        protected PasswordAuthentication getPasswordAuthentication() {
            if (getRequestorType() != RequestorType.PROXY) {
                return null;
            }
            var password = endpoint.password() == null ? new char[0] : endpoint.password().toCharArray();
            return new PasswordAuthentication(endpoint.username(), password);
        }
    }
}
