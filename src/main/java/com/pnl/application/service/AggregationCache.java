package com.pnl.application.service;

import com.pnl.application.usecase.pnl.DailyPLAggregator;
import com.pnl.domain.model.MonthlyPLSummary;
import com.pnl.infrastructure.config.EngineConfig;
import io.smallrye.mutiny.Uni;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.YearMonth;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Caches monthly summaries per portfolio and month.
 * <p>
 * Concurrent requests for the same key share a single computation. An entry stays fresh for the configured
 * time-to-live counted from the moment its computation completed. Failed computations are never cached.
 */
@Slf4j
@ApplicationScoped
public class AggregationCache {

    private final Map<Key, Entry> entries = new ConcurrentHashMap<>();
    private final Function<Key, Uni<MonthlyPLSummary>> loader;
    private final Duration ttl;
    private final Clock clock;

    @Inject
    public AggregationCache(DailyPLAggregator aggregator, EngineConfig config, Clock clock) {
        this(key -> aggregator.aggregate(key.portfolioId(), key.month()), config.cache().ttl(), clock);
    }

    public AggregationCache(Function<Key, Uni<MonthlyPLSummary>> loader, Duration ttl, Clock clock) {
        this.loader = loader;
        this.ttl = ttl;
        this.clock = clock;
    }

    public Uni<MonthlyPLSummary> get(UUID portfolioId, YearMonth month) {
        return get(new Key(portfolioId, month));
    }

    public Uni<MonthlyPLSummary> get(Key key) {
        return Uni.createFrom().deferred(() -> {
            Instant now = clock.instant();
            Entry candidate = new Entry(key);
            Entry winner = entries.compute(key, (ignored, existing) ->
                    existing != null && existing.isFresh(now) ? existing : candidate);

            if (winner == candidate) {
                log.debug("Cache miss: portfolioId={}, month={}", key.portfolioId(), key.month());
                sweepExpired(now);
            }
            return winner.result;
        });
    }

    public void invalidate(Key key) {
        if (entries.remove(key) != null) {
            log.debug("Cache entry invalidated: portfolioId={}, month={}", key.portfolioId(), key.month());
        }
    }

    public void invalidatePortfolio(UUID portfolioId) {
        entries.keySet().removeIf(key -> key.portfolioId().equals(portfolioId));
        log.debug("Cache invalidated for portfolio: portfolioId={}", portfolioId);
    }

    public void invalidateAll() {
        entries.clear();
    }

    public int size() {
        return entries.size();
    }

    private void sweepExpired(Instant now) {
        entries.values().removeIf(entry -> !entry.isFresh(now));
    }

    public record Key(UUID portfolioId, YearMonth month) {
    }

    private final class Entry {

        private final Uni<MonthlyPLSummary> result;
        // null while the computation is in flight
        private volatile Instant completedAt;

        private Entry(Key key) {
            this.result = Uni.createFrom().deferred(() -> loader.apply(key))
                    .onItem().invoke(ignored -> completedAt = clock.instant())
                    .onFailure().invoke(throwable -> {
                        log.warn("Aggregation failed, not cached: portfolioId={}, month={}, error={}",
                                key.portfolioId(), key.month(), throwable.getMessage());
                        entries.remove(key, this);
                    })
                    .memoize().indefinitely();
        }

        private boolean isFresh(Instant now) {
            Instant completed = completedAt;
            return completed == null || now.isBefore(completed.plus(ttl));
        }
    }
}
