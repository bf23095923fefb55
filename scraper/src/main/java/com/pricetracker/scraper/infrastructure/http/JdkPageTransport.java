package com.pricetracker.scraper.infrastructure.http;

import com.pricetracker.scraper.domain.exceptions.TransientFetchException;
import com.pricetracker.scraper.domain.extraction.FetchedPage;
import com.pricetracker.scraper.domain.extraction.PageTransport;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import lombok.RequiredArgsConstructor;

/**
 * GETs pages through one proxied client with browser-like headers.
 */
@RequiredArgsConstructor
class JdkPageTransport implements PageTransport {

    private final HttpClient client;
    private final String userAgent;
    private final Duration requestTimeout;

    @Override
    public FetchedPage fetch(URI url) {
        var request = HttpRequest.newBuilder(url)
                .timeout(requestTimeout)
                .header("User-Agent", userAgent)
                .header("Accept", "text/html,application/xhtml+xml,application/xml;q=0.9,*/*;q=0.8")
                .header("Accept-Language", "en-US,en;q=0.9")
                .GET()
                .build();

        var startNanos = System.nanoTime();
        HttpResponse<String> response;
        try {
            response = client.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (HttpTimeoutException e) {
            throw TransientFetchException.timeout(url);
        } catch (IOException e) {
            throw TransientFetchException.of(url, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw TransientFetchException.of(url, e);
        }

        var status = response.statusCode();
        if (status < 200 || status >= 300) {
            throw TransientFetchException.status(url, status);
        }
        return new FetchedPage(url, status, response.body(), Duration.ofNanos(System.nanoTime() - startNanos));
    }
}
