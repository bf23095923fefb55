package com.pricetracker.scraper.infrastructure.http;

import com.pricetracker.scraper.domain.proxy.ProxyEndpoint;
import com.pricetracker.scraper.domain.proxy.ProxyProbe;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
public class HttpProxyProbe implements ProxyProbe {

    static final String USER_AGENT = "ProxyHealthCheck/1.0";

    private final ProxiedHttpClients clients;

    @Override
    public boolean probe(ProxyEndpoint endpoint, URI target, Duration timeout) {
        var request = HttpRequest.newBuilder(target)
                .timeout(timeout)
                .header("User-Agent", USER_AGENT)
                .GET()
                .build();
        try {
            var response = clients.clientFor(endpoint).send(request, HttpResponse.BodyHandlers.discarding());
            if (response.statusCode() != 200) {
                log.debug("Probe of {} via {} returned HTTP {}", endpoint, target, response.statusCode());
                return false;
            }
            return true;
        } catch (IOException e) {
            log.debug("Probe of {} via {} failed: {}", endpoint, target, e.toString());
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
