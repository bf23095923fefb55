package com.pricetracker.scraper.domain.extraction;

import com.pricetracker.scraper.domain.exceptions.TransientFetchException;
import java.net.URI;

/**
 * Network access for extractors, already bound to one outbound proxy.
 */
public interface PageTransport {

    /**
     * @throws TransientFetchException on I/O errors, timeouts and non-2xx responses
     */
    FetchedPage fetch(URI url);
}
