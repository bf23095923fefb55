package com.pricetracker.scraper.domain.proxy;

import java.net.URI;
import java.time.Duration;

/**
 * Checks that an endpoint can reach a known-good echo target. Implementations may throw;
 * the pool treats any exception as a failed probe.
 */
public interface ProxyProbe {

    boolean probe(ProxyEndpoint endpoint, URI target, Duration timeout);
}
