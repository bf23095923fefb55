package com.pricetracker.scraper.domain.proxy;

import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.SmartLifecycle;

/**
 * Health-aware pool of outbound proxy endpoints.
 *
 * <p>Selection is weighted by {@code 0.7 * successRate + 0.3 / (selections + 1)}, so
 * reliable endpoints win most draws while rarely used ones still get traffic. Endpoints whose
 * failure rate exceeds the threshold are put into cool-down, and a periodic sweep probes every
 * endpoint against an echo target to exclude dead ones and revive blocked ones.
 *
 * <p>Every read-modify-write of health state runs under {@link #lock}. Probes run outside it.
 */
@Slf4j
public class ProxyPool implements SmartLifecycle {

    private final Map<ProxyEndpoint, ProxyHealth> endpoints = new LinkedHashMap<>();
    private final ReentrantLock lock = new ReentrantLock();

    private final ProxyProbe probe;
    private final ProxyStatusPublisher statusPublisher;
    private final ProxyPoolSettings settings;
    private final Clock clock;
    private final Random random;

    private ScheduledExecutorService sweepScheduler;
    private volatile ExecutorService probeExecutor;
    private ScheduledFuture<?> sweepTask;
    private volatile boolean running;

    public ProxyPool(
            ProxyProbe probe,
            ProxyStatusPublisher statusPublisher,
            ProxyPoolSettings settings,
            Clock clock,
            Random random) {
        this.probe = probe;
        this.statusPublisher = statusPublisher;
        this.settings = settings;
        this.clock = clock;
        this.random = random;
    }

    public Optional<ProxyEndpoint> acquire() {
        lock.lock();
        try {
            var now = clock.instant();
            var candidates = new ArrayList<Map.Entry<ProxyEndpoint, ProxyHealth>>();
            var weights = new double[endpoints.size()];
            var total = 0.0;
            for (var entry : endpoints.entrySet()) {
                if (entry.getValue().isEligible(now)) {
                    var score = entry.getValue().score();
                    weights[candidates.size()] = score;
                    total += score;
                    candidates.add(entry);
                }
            }
            if (candidates.isEmpty()) {
                return Optional.empty();
            }

            var chosen = candidates.get(pick(weights, candidates.size(), total));
            chosen.getValue().markSelected(now);
            return Optional.of(chosen.getKey());
        } finally {
            lock.unlock();
        }
    }

    private int pick(double[] weights, int count, double total) {
        if (total <= 0) {
            return random.nextInt(count);
        }
        var target = random.nextDouble() * total;
        var cumulative = 0.0;
        for (int i = 0; i < count; i++) {
            cumulative += weights[i];
            if (target < cumulative) {
                return i;
            }
        }
        return count - 1;
    }

    public void report(ProxyEndpoint endpoint, ProxyOutcome outcome, Duration latency) {
        lock.lock();
        try {
            var health = endpoints.get(endpoint);
            if (health == null) {
                log.debug("Ignoring {} report for removed proxy {}", outcome, endpoint);
                return;
            }
            if (outcome == ProxyOutcome.SUCCESS) {
                health.recordSuccess(latency, settings.latencyAlpha());
                return;
            }
            var now = clock.instant();
            if (health.recordFailure(now, settings)) {
                log.warn(
                        "Blocking proxy {} until {} (failures={}, successes={})",
                        endpoint,
                        health.blockedUntil(),
                        health.failureCount(),
                        health.successCount());
            }
        } finally {
            lock.unlock();
        }
    }

    public boolean add(ProxyEndpoint endpoint) {
        lock.lock();
        try {
            if (endpoints.containsKey(endpoint)) {
                return false;
            }
            endpoints.put(endpoint, new ProxyHealth());
            log.info("Added proxy {}", endpoint);
            return true;
        } finally {
            lock.unlock();
        }
    }

    public boolean remove(ProxyEndpoint endpoint) {
        lock.lock();
        try {
            var removed = endpoints.remove(endpoint) != null;
            if (removed) {
                log.info("Removed proxy {}", endpoint);
            }
            return removed;
        } finally {
            lock.unlock();
        }
    }

    public SweepResult healthSweep() {
        List<ProxyEndpoint> known;
        lock.lock();
        try {
            known = List.copyOf(endpoints.keySet());
        } finally {
            lock.unlock();
        }
        if (known.isEmpty()) {
            return SweepResult.empty();
        }

        var shared = probeExecutor;
        var executor = shared != null ? shared : Executors.newFixedThreadPool(
                Math.min(known.size(), settings.probeConcurrency()), threadFactory("proxy-probe-"));
        Map<ProxyEndpoint, CompletableFuture<Boolean>> probes = new LinkedHashMap<>();
        try {
            for (var endpoint : known) {
                var target = settings.probeTargets().get(random.nextInt(settings.probeTargets().size()));
                probes.put(endpoint, CompletableFuture
                        .supplyAsync(() -> probeQuietly(endpoint, target), executor)
                        .completeOnTimeout(false, settings.probeTimeout().multipliedBy(2).toMillis(),
                                TimeUnit.MILLISECONDS));
            }
            CompletableFuture.allOf(probes.values().toArray(CompletableFuture[]::new)).join();
        } finally {
            if (executor != shared) {
                executor.shutdownNow();
            }
        }

        var result = applyProbeResults(probes);
        log.info(
                "Proxy health sweep: probed={}, passed={}, failed={}, unblocked={}",
                result.probed(),
                result.passed().size(),
                result.failed().size(),
                result.unblocked());
        statusPublisher.publishHealthy(result.passed());
        return result;
    }

    private boolean probeQuietly(ProxyEndpoint endpoint, URI target) {
        try {
            return probe.probe(endpoint, target, settings.probeTimeout());
        } catch (RuntimeException e) {
            log.debug("Probe of {} via {} failed: {}", endpoint, target, e.getMessage());
            return false;
        }
    }

    private SweepResult applyProbeResults(Map<ProxyEndpoint, CompletableFuture<Boolean>> probes) {
        var passed = new ArrayList<ProxyEndpoint>();
        var failed = new ArrayList<ProxyEndpoint>();
        var unblocked = 0;
        lock.lock();
        try {
            for (var entry : probes.entrySet()) {
                var health = endpoints.get(entry.getKey());
                if (health == null) {
                    continue;
                }
                if (Boolean.TRUE.equals(entry.getValue().getNow(false))) {
                    if (health.blockedUntil() != null) {
                        unblocked++;
                    }
                    health.probePassed();
                    passed.add(entry.getKey());
                } else {
                    health.probeFailed();
                    failed.add(entry.getKey());
                }
            }
        } finally {
            lock.unlock();
        }
        return new SweepResult(probes.size(), List.copyOf(passed), List.copyOf(failed), unblocked);
    }

    public ProxyPoolStats stats() {
        lock.lock();
        try {
            var now = clock.instant();
            int eligible = 0;
            int blocked = 0;
            long selections = 0;
            long successes = 0;
            long failures = 0;
            double weightedLatency = 0;
            long latencyWeight = 0;
            for (var health : endpoints.values()) {
                if (health.isEligible(now)) {
                    eligible++;
                }
                if (health.isBlocked(now)) {
                    blocked++;
                }
                selections += health.selectionCount();
                successes += health.successCount();
                failures += health.failureCount();
                if (health.averageLatencyMillis() != null) {
                    var weight = Math.max(1, health.selectionCount());
                    weightedLatency += health.averageLatencyMillis() * weight;
                    latencyWeight += weight;
                }
            }
            var reported = successes + failures;
            return ProxyPoolStats.builder()
                    .endpoints(endpoints.size())
                    .eligible(eligible)
                    .blocked(blocked)
                    .selections(selections)
                    .successes(successes)
                    .failures(failures)
                    .successRate(reported == 0 ? 0 : (double) successes / reported)
                    .averageLatencyMillis(latencyWeight == 0 ? 0 : weightedLatency / latencyWeight)
                    .build();
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return endpoints.size();
        } finally {
            lock.unlock();
        }
    }

    public int eligibleCount() {
        return stats().eligible();
    }

    @Override
    public void start() {
        if (running) {
            return;
        }
        probeExecutor = Executors.newFixedThreadPool(settings.probeConcurrency(), threadFactory("proxy-probe-"));
        sweepScheduler = Executors.newSingleThreadScheduledExecutor(threadFactory("proxy-sweep-"));
        var interval = settings.sweepInterval().toMillis();
        sweepTask = sweepScheduler.scheduleWithFixedDelay(this::sweepSafely, 0, interval, TimeUnit.MILLISECONDS);
        running = true;
        log.info("Proxy pool started with {} endpoints, sweeping every {}", size(), settings.sweepInterval());
    }

    private void sweepSafely() {
        try {
            healthSweep();
        } catch (RuntimeException e) {
            log.error("Proxy health sweep failed", e);
        }
    }

    @Override
    public void stop() {
        if (!running) {
            return;
        }
        running = false;
        sweepTask.cancel(true);
        sweepScheduler.shutdownNow();
        probeExecutor.shutdownNow();
        probeExecutor = null;
        log.info("Proxy pool stopped");
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    Instant blockedUntil(ProxyEndpoint endpoint) {
        lock.lock();
        try {
            var health = endpoints.get(endpoint);
            return health == null ? null : health.blockedUntil();
        } finally {
            lock.unlock();
        }
    }

    private static ThreadFactory threadFactory(String prefix) {
        var counter = new AtomicInteger();
        return runnable -> {
            var thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
