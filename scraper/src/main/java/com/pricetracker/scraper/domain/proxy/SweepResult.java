package com.pricetracker.scraper.domain.proxy;

import java.util.List;

public record SweepResult(int probed, List<ProxyEndpoint> passed, List<ProxyEndpoint> failed, int unblocked) {

    static SweepResult empty() {
        return new SweepResult(0, List.of(), List.of(), 0);
    }
}
