package com.pricetracker.scraper.domain.scrape;

import com.pricetracker.common.event.PriceUpdate;
import com.pricetracker.scraper.domain.alert.AlertDispatcher;
import com.pricetracker.scraper.domain.alert.AlertEvaluator;
import com.pricetracker.scraper.domain.alert.AlertNotification;
import com.pricetracker.scraper.domain.alert.AlertSettings;
import com.pricetracker.scraper.domain.alert.AlertThresholds;
import com.pricetracker.scraper.domain.alert.PriceSummary;
import com.pricetracker.scraper.domain.exceptions.ExtractionException;
import com.pricetracker.scraper.domain.exceptions.PageParseException;
import com.pricetracker.scraper.domain.exceptions.ProxyExhaustedException;
import com.pricetracker.scraper.domain.exceptions.StoreUnavailableException;
import com.pricetracker.scraper.domain.exceptions.UnsupportedMarketplaceException;
import com.pricetracker.scraper.domain.extraction.ExtractorRegistry;
import com.pricetracker.scraper.domain.extraction.PageTransportFactory;
import com.pricetracker.scraper.domain.proxy.ProxyOutcome;
import com.pricetracker.scraper.domain.proxy.ProxyPool;
import com.pricetracker.scraper.domain.tracking.ItemStore;
import com.pricetracker.scraper.domain.tracking.PriceUpdatePublisher;
import com.pricetracker.scraper.domain.tracking.Snapshot;
import com.pricetracker.scraper.domain.tracking.SnapshotRecorder;
import com.pricetracker.scraper.domain.tracking.TrackedItem;
import jakarta.annotation.PreDestroy;
import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Drives fetches of tracked items through the proxy pool and extractors.
 *
 * <p>Scheduled cycles and on-demand requests share one fixed-size worker pool. An item is
 * leased for the duration of its fetch, so a second request for it is skipped rather than run
 * in parallel. The item is read again once leased, so statistics and error counts always build
 * on the latest committed state rather than on the copy listed at cycle start. Per-item errors
 * are turned into item state; only an unreachable item store aborts a cycle.
 */
@Slf4j
@Service
public class ScrapeOrchestrator {

    private final ItemStore itemStore;
    private final ProxyPool proxyPool;
    private final ExtractorRegistry extractorRegistry;
    private final PageTransportFactory transportFactory;
    private final SnapshotRecorder snapshotRecorder;
    private final AlertEvaluator alertEvaluator;
    private final AlertDispatcher alertDispatcher;
    private final PriceUpdatePublisher priceUpdatePublisher;
    private final ScrapeSettings settings;
    private final AlertSettings alertSettings;
    private final ScrapeCounters counters;
    private final Clock clock;

    private final ThreadPoolExecutor workers;
    private final Set<UUID> inFlight = ConcurrentHashMap.newKeySet();
    private final AtomicBoolean cycleRunning = new AtomicBoolean();

    public ScrapeOrchestrator(
            ItemStore itemStore,
            ProxyPool proxyPool,
            ExtractorRegistry extractorRegistry,
            PageTransportFactory transportFactory,
            SnapshotRecorder snapshotRecorder,
            AlertEvaluator alertEvaluator,
            AlertDispatcher alertDispatcher,
            PriceUpdatePublisher priceUpdatePublisher,
            ScrapeSettings settings,
            AlertSettings alertSettings,
            ScrapeCounters counters,
            Clock clock) {
        this.itemStore = itemStore;
        this.proxyPool = proxyPool;
        this.extractorRegistry = extractorRegistry;
        this.transportFactory = transportFactory;
        this.snapshotRecorder = snapshotRecorder;
        this.alertEvaluator = alertEvaluator;
        this.alertDispatcher = alertDispatcher;
        this.priceUpdatePublisher = priceUpdatePublisher;
        this.settings = settings;
        this.alertSettings = alertSettings;
        this.counters = counters;
        this.clock = clock;

        var threadCounter = new AtomicInteger();
        this.workers = new ThreadPoolExecutor(
                settings.concurrency(),
                settings.concurrency(),
                0L,
                TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(),
                runnable -> new Thread(runnable, "scrape-worker-" + threadCounter.incrementAndGet()));
    }

    public CycleSummary runCycle() {
        var startedAt = clock.instant();
        if (!cycleRunning.compareAndSet(false, true)) {
            log.info("Scrape cycle still running, skipping trigger at {}", startedAt);
            return CycleSummary.overlapping(startedAt);
        }
        try {
            return runExclusiveCycle();
        } finally {
            cycleRunning.set(false);
        }
    }

    private CycleSummary runExclusiveCycle() {
        var startedAt = clock.instant();
        var startNanos = System.nanoTime();

        List<TrackedItem> due;
        try {
            due = itemStore.listDueItems(settings.batchSize(), startedAt);
        } catch (StoreUnavailableException e) {
            counters.cyclesAborted().increment();
            log.error("Scrape cycle aborted: could not list due items", e);
            throw e;
        }
        log.info("Scrape cycle started: {} due items, concurrency {}", due.size(), settings.concurrency());

        var fatal = new AtomicReference<StoreUnavailableException>();
        var futures = new ArrayList<Future<ItemOutcome>>(due.size());
        for (var item : due) {
            futures.add(submit(() -> runCycleTask(item, fatal)));
        }

        Map<ItemOutcome, Integer> tally = new EnumMap<>(ItemOutcome.class);
        for (var future : futures) {
            tally.merge(await(future), 1, Integer::sum);
        }

        if (fatal.get() != null) {
            counters.cyclesAborted().increment();
            log.error("Scrape cycle aborted after item store failure, outcomes so far: {}", tally);
            throw fatal.get();
        }

        var succeeded = tally.getOrDefault(ItemOutcome.SUCCEEDED, 0);
        var failed = tally.getOrDefault(ItemOutcome.FAILED, 0);
        var summary = new CycleSummary(
                due.size(),
                succeeded,
                failed,
                due.size() - succeeded - failed,
                startedAt,
                Duration.ofNanos(System.nanoTime() - startNanos),
                false);
        counters.cyclesCompleted().increment();
        log.info(
                "Scrape cycle finished in {}: due={}, succeeded={}, failed={}, skipped={}",
                summary.elapsed(),
                summary.due(),
                summary.succeeded(),
                summary.failed(),
                summary.skipped());
        return summary;
    }

    private ItemOutcome runCycleTask(TrackedItem item, AtomicReference<StoreUnavailableException> fatal) {
        if (fatal.get() != null) {
            return ItemOutcome.ABANDONED;
        }
        try {
            return scrape(item.id(), true);
        } catch (StoreUnavailableException e) {
            fatal.compareAndSet(null, e);
            counters.failed().increment();
            return ItemOutcome.FAILED;
        }
    }

    public ItemOutcome scrapeOne(UUID itemId) {
        try {
            return enqueue(itemId).get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ItemOutcome.ABANDONED;
        } catch (CancellationException e) {
            return ItemOutcome.ABANDONED;
        } catch (ExecutionException e) {
            if (e.getCause() instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new IllegalStateException("Scrape of item " + itemId + " failed", e.getCause());
        }
    }

    /**
     * Queues a fetch of one item on the shared worker pool. The future fails with
     * {@link StoreUnavailableException} when the item store cannot be reached.
     */
    public Future<ItemOutcome> enqueue(UUID itemId) {
        return submit(() -> scrape(itemId, false));
    }

    private Future<ItemOutcome> submit(Callable<ItemOutcome> task) {
        try {
            return workers.submit(task);
        } catch (RejectedExecutionException e) {
            log.debug("Worker pool is shut down, abandoning task");
            return CompletableFuture.completedFuture(ItemOutcome.ABANDONED);
        }
    }

    private ItemOutcome await(Future<ItemOutcome> future) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ItemOutcome.ABANDONED;
        } catch (CancellationException e) {
            return ItemOutcome.ABANDONED;
        } catch (ExecutionException e) {
            log.error("Unexpected error escaped a scrape task", e.getCause());
            return ItemOutcome.FAILED;
        }
    }

    /**
     * @param onlyIfDue skip the item unless it is still ACTIVE and due when the lease is taken
     */
    ItemOutcome scrape(UUID itemId, boolean onlyIfDue) {
        if (!inFlight.add(itemId)) {
            log.debug("Item {} already being fetched, skipping", itemId);
            counters.skipped().increment();
            return ItemOutcome.SKIPPED_IN_FLIGHT;
        }
        try {
            var item = itemStore.findById(itemId).orElse(null);
            if (item == null) {
                log.debug("Scrape requested for unknown item {}", itemId);
                counters.skipped().increment();
                return ItemOutcome.NOT_FOUND;
            }
            if (onlyIfDue && !item.isDue(clock.instant())) {
                log.debug(
                        "Item {} no longer due (status={}, last checked {}), skipping",
                        itemId,
                        item.status(),
                        item.lastChecked());
                counters.skipped().increment();
                return ItemOutcome.SKIPPED_NOT_DUE;
            }
            return fetchAndRecord(item);
        } finally {
            inFlight.remove(itemId);
        }
    }

    private ItemOutcome fetchAndRecord(TrackedItem item) {
        var endpoint = proxyPool.acquire().orElse(null);
        if (endpoint == null) {
            var exhausted = ProxyExhaustedException.of(proxyPool.size());
            log.debug("Skipping item {}: {}", item.id(), exhausted.getMessage());
            counters.skipped().increment();
            return ItemOutcome.SKIPPED_NO_PROXY;
        }

        var startNanos = System.nanoTime();
        Snapshot snapshot;
        Duration responseTime;
        try {
            var extractor = extractorRegistry.forMarketplace(item.marketplace());
            var listing = extractor.extract(URI.create(item.url()), transportFactory.forEndpoint(endpoint));
            responseTime = Duration.ofNanos(System.nanoTime() - startNanos);
            snapshot = snapshotRecorder.recordSuccess(item, listing, responseTime, clock.instant());
        } catch (ExtractionException e) {
            proxyPool.report(endpoint, ProxyOutcome.FAILURE, Duration.ofNanos(System.nanoTime() - startNanos));
            if (e instanceof PageParseException parseError) {
                counters.parseErrors().increment();
                log.warn("Unexpected {} page for item {}: {}", parseError.marketplace(), item.id(), e.getMessage());
            } else {
                log.debug("Fetch of item {} via {} failed: {}", item.id(), endpoint, e.getMessage());
            }
            return recordFailure(item, e.getMessage());
        } catch (UnsupportedMarketplaceException e) {
            return recordFailure(item, e.getMessage());
        } catch (StoreUnavailableException e) {
            throw e;
        } catch (RuntimeException e) {
            log.warn("Unexpected error scraping item {}", item.id(), e);
            return recordFailure(item, e.getClass().getSimpleName() + ": " + e.getMessage());
        }

        // The observation is committed from here on; nothing below may turn it into a failure.
        proxyPool.report(endpoint, ProxyOutcome.SUCCESS, responseTime);
        counters.succeeded().increment();
        dispatchAlerts(item, snapshot);
        publishPriceUpdate(item, snapshot);
        return ItemOutcome.SUCCEEDED;
    }

    private ItemOutcome recordFailure(TrackedItem item, String error) {
        counters.failed().increment();
        snapshotRecorder.recordFailure(item, error, clock.instant(), settings.errorCeiling());
        return ItemOutcome.FAILED;
    }

    private void dispatchAlerts(TrackedItem item, Snapshot snapshot) {
        var events = alertEvaluator.evaluate(
                PriceSummary.of(item), snapshot, AlertThresholds.of(item.targetPrice(), alertSettings));
        for (var event : events) {
            try {
                alertDispatcher.dispatch(new AlertNotification(event, item));
            } catch (RuntimeException e) {
                log.error("Could not dispatch {} alert for item {}", event.kind(), item.id(), e);
            }
        }
    }

    private void publishPriceUpdate(TrackedItem item, Snapshot snapshot) {
        try {
            priceUpdatePublisher.publish(priceUpdate(item, snapshot));
        } catch (RuntimeException e) {
            log.warn("Could not publish price update for item {}", item.id(), e);
        }
    }

    private static PriceUpdate priceUpdate(TrackedItem item, Snapshot snapshot) {
        var oldPrice = item.currentPrice();
        var changePercent = oldPrice == null || oldPrice.signum() == 0
                ? BigDecimal.ZERO
                : snapshot.price().subtract(oldPrice)
                        .divide(oldPrice, MathContext.DECIMAL64)
                        .multiply(BigDecimal.valueOf(100))
                        .setScale(4, RoundingMode.HALF_UP);
        return PriceUpdate.builder()
                .productId(item.id())
                .oldPrice(oldPrice)
                .newPrice(snapshot.price())
                .currency(snapshot.currency())
                .inStock(snapshot.inStock())
                .changePercent(changePercent)
                .timestamp(snapshot.observedAt())
                .build();
    }

    boolean isInFlight(UUID itemId) {
        return inFlight.contains(itemId);
    }

    /**
     * Stops accepting work, lets running fetches finish within the grace period and abandons
     * whatever is still queued.
     */
    @PreDestroy
    public void shutdown() {
        var abandoned = new ArrayList<Runnable>();
        workers.getQueue().drainTo(abandoned);
        workers.shutdown();
        for (var task : abandoned) {
            if (task instanceof Future<?> future) {
                future.cancel(false);
            }
        }
        if (!abandoned.isEmpty()) {
            log.info("Abandoned {} queued scrape tasks on shutdown", abandoned.size());
        }
        try {
            if (!workers.awaitTermination(settings.shutdownGrace().toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Scrape workers did not finish within {}, interrupting", settings.shutdownGrace());
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
