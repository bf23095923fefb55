package com.pricetracker.scraper.domain.scrape;

import com.pricetracker.common.event.Marketplace;
import com.pricetracker.common.event.PriceUpdate;
import com.pricetracker.scraper.domain.alert.AlertDispatcher;
import com.pricetracker.scraper.domain.alert.AlertEvaluator;
import com.pricetracker.scraper.domain.alert.AlertSettings;
import com.pricetracker.scraper.domain.extraction.ExtractedListing;
import com.pricetracker.scraper.domain.extraction.ExtractorRegistry;
import com.pricetracker.scraper.domain.extraction.MarketplaceExtractor;
import com.pricetracker.scraper.domain.extraction.PageTransport;
import com.pricetracker.scraper.domain.proxy.ProxyEndpoint;
import com.pricetracker.scraper.domain.proxy.ProxyPool;
import com.pricetracker.scraper.domain.proxy.ProxyPoolSettings;
import com.pricetracker.scraper.domain.tracking.SnapshotRecorder;
import com.pricetracker.scraper.test.fixtures.InMemoryItemStore;
import com.pricetracker.scraper.test.fixtures.MutableClock;
import com.pricetracker.scraper.test.fixtures.TrackedItemFixtures;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.Random;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Function;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
public abstract class ScrapeOrchestratorBaseTest {

    static final ProxyEndpoint PROXY_A = ProxyEndpoint.parse("http://10.0.0.1:8080");
    static final ProxyEndpoint PROXY_B = ProxyEndpoint.parse("http://10.0.0.2:8080");

    @Mock
    AlertDispatcher alertDispatcher;

    MutableClock clock;
    InMemoryItemStore itemStore;
    ProxyPool proxyPool;
    ScriptedExtractor extractor;
    List<PriceUpdate> publishedUpdates;
    SimpleMeterRegistry registry;
    ScrapeCounters counters;
    ScrapeOrchestrator orchestrator;
    volatile RuntimeException publishFailure;

    @BeforeEach
    void setUpOrchestrator() {
        clock = new MutableClock(TrackedItemFixtures.SOME_TIME);
        itemStore = new InMemoryItemStore();
        proxyPool = new ProxyPool(
                (endpoint, target, timeout) -> true,
                healthy -> { },
                ProxyPoolSettings.defaults().minOutcomesForBlock(Integer.MAX_VALUE).build(),
                clock,
                new Random(7));
        proxyPool.add(PROXY_A);
        proxyPool.add(PROXY_B);
        extractor = new ScriptedExtractor();
        publishedUpdates = new CopyOnWriteArrayList<>();
        registry = new SimpleMeterRegistry();
        counters = new ScrapeCounters(
                registry.counter("scraper.items.succeeded"),
                registry.counter("scraper.items.failed"),
                registry.counter("scraper.items.skipped"),
                registry.counter("scraper.items.parse-errors"),
                registry.counter("scraper.cycles.completed"),
                registry.counter("scraper.cycles.aborted"));
        orchestrator = orchestrator(ScrapeSettings.defaults().shutdownGrace(Duration.ofSeconds(5)).build());
    }

    @AfterEach
    void shutDownOrchestrator() {
        orchestrator.shutdown();
    }

    ScrapeOrchestrator orchestrator(ScrapeSettings settings) {
        return new ScrapeOrchestrator(
                itemStore,
                proxyPool,
                new ExtractorRegistry(List.of(extractor)),
                endpoint -> url -> {
                    throw new IllegalStateException("network access is not expected in this test");
                },
                new SnapshotRecorder(itemStore),
                new AlertEvaluator(),
                alertDispatcher,
                update -> {
                    if (publishFailure != null) {
                        throw publishFailure;
                    }
                    publishedUpdates.add(update);
                },
                settings,
                AlertSettings.defaults().build(),
                counters,
                clock);
    }

    static final class ScriptedExtractor implements MarketplaceExtractor {

        volatile Function<URI, ExtractedListing> script =
                url -> TrackedItemFixtures.listingBuilder("100.00").build();

        @Override
        public Marketplace marketplace() {
            return Marketplace.AMAZON;
        }

        @Override
        public ExtractedListing extract(URI url, PageTransport transport) {
            return script.apply(url);
        }
    }
}
