package com.ifip.fundamentals.batch;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.ifip.fundamentals.domain.FundamentalsReport;
import com.ifip.fundamentals.ingestion.TickerDirectory;
import com.ifip.fundamentals.service.FundamentalsService;
import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Refreshes many tickers in parallel on the bounded batch executor. A failing ticker never fails
 * the batch; it is reported in the result next to the others.
 */
@Service
public class FundamentalsBatchService {

    private static final Logger LOGGER = LoggerFactory.getLogger(FundamentalsBatchService.class);

    private final FundamentalsService fundamentalsService;
    private final ExecutorService executor;
    private final Clock clock;
    private final Cache<UUID, BatchRefresh> recentRuns = Caffeine.newBuilder()
        .maximumSize(50)
        .expireAfterWrite(Duration.ofHours(24))
        .build();

    public FundamentalsBatchService(
        FundamentalsService fundamentalsService,
        @Qualifier("fundamentalsBatchExecutor") ExecutorService executor,
        Clock clock
    ) {
        this.fundamentalsService = fundamentalsService;
        this.executor = executor;
        this.clock = clock;
    }

    public BatchRefresh refresh(List<String> tickers) {
        if (tickers == null || tickers.isEmpty()) {
            throw new IllegalArgumentException("tickers must not be empty");
        }
        Set<String> unique = new LinkedHashSet<>();
        for (String ticker : tickers) {
            String normalized = TickerDirectory.normalize(ticker);
            if (normalized.isEmpty()) {
                throw new IllegalArgumentException("Ticker must not be blank");
            }
            unique.add(normalized);
        }

        UUID runId = UUID.randomUUID();
        Map<String, Future<FundamentalsReport>> tasks = new LinkedHashMap<>();
        for (String ticker : unique) {
            tasks.put(ticker, executor.submit(() -> refreshOne(runId, ticker)));
        }
        BatchRefresh batch = new BatchRefresh(runId, tasks, clock);
        recentRuns.put(runId, batch);
        LOGGER.info("Started batch {} for {} tickers", runId, unique.size());
        return batch;
    }

    public Optional<BatchRefresh> findRun(UUID runId) {
        return Optional.ofNullable(recentRuns.getIfPresent(runId));
    }

    private FundamentalsReport refreshOne(UUID runId, String ticker) {
        try {
            FundamentalsReport report = fundamentalsService.refresh(ticker);
            LOGGER.debug("Batch {}: {} graded {}", runId, ticker, report.quality().grade().label());
            return report;
        } catch (RuntimeException e) {
            LOGGER.warn("Batch {}: {} failed: {}", runId, ticker, e.getMessage());
            throw e;
        }
    }
}
