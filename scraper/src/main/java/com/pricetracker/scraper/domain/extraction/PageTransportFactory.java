package com.pricetracker.scraper.domain.extraction;

import com.pricetracker.scraper.domain.proxy.ProxyEndpoint;

public interface PageTransportFactory {

    PageTransport forEndpoint(ProxyEndpoint endpoint);
}
