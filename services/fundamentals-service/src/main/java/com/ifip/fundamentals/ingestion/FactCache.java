package com.ifip.fundamentals.ingestion;

import com.github.benmanes.caffeine.cache.AsyncCache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import com.ifip.fundamentals.config.FundamentalsProperties;
import com.ifip.fundamentals.domain.RawFactSet;
import com.ifip.fundamentals.exception.IngestionCancelledException;
import java.time.Duration;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Read-through cache of raw fact sets keyed {@code facts:{TICKER}}.
 *
 * <p>The first caller for a missing key registers a pending future and runs the load on its own
 * thread, so interrupting that caller cancels the upstream request. Concurrent callers for the
 * same key wait on the pending future instead of issuing their own request, and so does a refresh
 * that arrives while that request is running. Failed loads are never cached.
 */
@Component
public class FactCache {

    private static final Logger LOGGER = LoggerFactory.getLogger(FactCache.class);

    private final AsyncCache<String, RawFactSet> cache;

    @Autowired
    public FactCache(FundamentalsProperties properties) {
        this(Duration.ofHours(properties.getCacheTtlHours()), properties.getCacheMaxEntries(), Ticker.systemTicker());
    }

    FactCache(Duration ttl, long maxEntries, Ticker ticker) {
        this.cache = Caffeine.newBuilder()
            .expireAfterWrite(ttl)
            .maximumSize(maxEntries)
            .ticker(ticker)
            .buildAsync();
    }

    public RawFactSet get(String ticker, Function<String, RawFactSet> loader) {
        String key = key(ticker);
        while (true) {
            CompletableFuture<RawFactSet> pending = new CompletableFuture<>();
            CompletableFuture<RawFactSet> inFlight = cache.asMap().putIfAbsent(key, pending);
            if (inFlight == null) {
                return load(ticker, key, pending, loader);
            }
            try {
                return await(key, inFlight);
            } catch (IngestionCancelledException e) {
                // the loading caller was cancelled; take over unless this caller was cancelled too
                if (Thread.currentThread().isInterrupted()) {
                    throw e;
                }
                LOGGER.debug("Shared fetch for {} was cancelled, retrying", key);
            }
        }
    }

    /**
     * Drops a completed entry. A load still in flight is left alone, so callers that invalidate and
     * then read join that load instead of starting a second upstream request.
     */
    public void invalidate(String ticker) {
        String key = key(ticker);
        CompletableFuture<RawFactSet> kept = cache.asMap().computeIfPresent(key, (k, entry) -> entry.isDone() ? null : entry);
        if (kept != null) {
            LOGGER.debug("Fetch for {} still in flight, joining it instead of invalidating", key);
        }
    }

    public boolean contains(String ticker) {
        CompletableFuture<RawFactSet> entry = cache.getIfPresent(key(ticker));
        return entry != null && entry.isDone() && !entry.isCompletedExceptionally();
    }

    static String key(String ticker) {
        return "facts:" + TickerDirectory.normalize(ticker);
    }

    private RawFactSet load(
        String ticker,
        String key,
        CompletableFuture<RawFactSet> pending,
        Function<String, RawFactSet> loader
    ) {
        try {
            RawFactSet loaded = loader.apply(ticker);
            pending.complete(loaded);
            return loaded;
        } catch (RuntimeException | Error e) {
            pending.completeExceptionally(e);
            cache.asMap().remove(key, pending);
            throw e;
        }
    }

    private RawFactSet await(String key, CompletableFuture<RawFactSet> inFlight) {
        try {
            return inFlight.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IngestionCancelledException(key, e);
        } catch (CancellationException e) {
            throw new IngestionCancelledException(key, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new IllegalStateException("Fact load failed for " + key, cause);
        }
    }
}
