package com.pricetracker.scraper.domain.proxy;

import java.util.List;

public interface ProxyStatusPublisher {

    void publishHealthy(List<ProxyEndpoint> healthy);
}
