package com.pricetracker.scraper.infrastructure.marketplace;

import com.pricetracker.scraper.domain.extraction.FetchedPage;
import com.pricetracker.scraper.domain.extraction.PageTransport;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

public abstract class ExtractorBaseTest {

    final List<URI> requested = new ArrayList<>();

    PageTransport serving(String resource) {
        var body = load(resource);
        return url -> {
            requested.add(url);
            return new FetchedPage(url, 200, body, Duration.ofMillis(120));
        };
    }

    static String load(String resource) {
        try (var in = ExtractorBaseTest.class.getResourceAsStream("/pages/" + resource)) {
            if (in == null) {
                throw new IllegalArgumentException("Missing test page " + resource);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
