package com.pricetracker.scraper.domain.extraction;

import java.net.URI;
import java.time.Duration;

public record FetchedPage(URI url, int statusCode, String body, Duration latency) {}
