package com.ifip.fundamentals.batch;

import com.ifip.fundamentals.domain.FundamentalsReport;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Handle on a running batch refresh.
 *
 * <p>{@link #cancel()} interrupts tickers that are being fetched and drops those still queued.
 * Reports that finished before the cancel are kept in every later {@link #snapshot()}.
 */
public class BatchRefresh {

    private static final Logger LOGGER = LoggerFactory.getLogger(BatchRefresh.class);

    private final UUID runId;
    private final Instant startedAt;
    private final Map<String, Future<FundamentalsReport>> tasks;
    private final Clock clock;
    private final AtomicBoolean cancelRequested = new AtomicBoolean();
    private final AtomicBoolean summaryLogged = new AtomicBoolean();
    private volatile Instant completedAt;

    BatchRefresh(UUID runId, Map<String, Future<FundamentalsReport>> tasks, Clock clock) {
        this.runId = runId;
        this.startedAt = clock.instant();
        this.tasks = new LinkedHashMap<>(tasks);
        this.clock = clock;
    }

    public UUID runId() {
        return runId;
    }

    public void cancel() {
        if (cancelRequested.compareAndSet(false, true)) {
            int interrupted = 0;
            for (Future<FundamentalsReport> task : tasks.values()) {
                if (task.cancel(true)) {
                    interrupted++;
                }
            }
            LOGGER.info("Batch {} cancelled, {} of {} tickers stopped", runId, interrupted, tasks.size());
        }
    }

    public boolean isDone() {
        return tasks.values().stream().allMatch(Future::isDone);
    }

    /**
     * Waits up to {@code timeout} for every ticker to finish and returns what is known by then.
     */
    public BatchRefreshResult await(Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        for (Future<FundamentalsReport> task : tasks.values()) {
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                break;
            }
            try {
                task.get(remaining, TimeUnit.NANOSECONDS);
            } catch (ExecutionException | CancellationException e) {
                // recorded by snapshot()
            } catch (TimeoutException e) {
                break;
            }
        }
        return snapshot();
    }

    public BatchRefreshResult snapshot() {
        Map<String, FundamentalsReport> reports = new LinkedHashMap<>();
        Map<String, String> failures = new LinkedHashMap<>();
        List<String> cancelled = new ArrayList<>();
        List<String> pending = new ArrayList<>();

        tasks.forEach((ticker, task) -> {
            if (task.isCancelled()) {
                cancelled.add(ticker);
            } else if (!task.isDone()) {
                pending.add(ticker);
            } else {
                try {
                    reports.put(ticker, task.get());
                } catch (ExecutionException e) {
                    Throwable cause = e.getCause();
                    failures.put(ticker, cause.getMessage() == null ? cause.getClass().getSimpleName() : cause.getMessage());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    pending.add(ticker);
                }
            }
        });

        RunStatus status = status(pending, cancelled, failures, reports);
        if (status != RunStatus.RUNNING && summaryLogged.compareAndSet(false, true)) {
            completedAt = clock.instant();
            LOGGER.info("Batch {} finished {}: {} reports ({} degraded), {} failed, {} cancelled",
                runId, status, reports.size(),
                reports.values().stream().filter(FundamentalsReport::degraded).count(),
                failures.size(), cancelled.size());
        }
        return new BatchRefreshResult(runId, status, startedAt, completedAt, reports, failures, cancelled, pending);
    }

    private RunStatus status(
        List<String> pending,
        List<String> cancelled,
        Map<String, String> failures,
        Map<String, FundamentalsReport> reports
    ) {
        if (!pending.isEmpty()) {
            return RunStatus.RUNNING;
        }
        if (cancelRequested.get() || !cancelled.isEmpty()) {
            return RunStatus.CANCELLED;
        }
        boolean anyDegraded = reports.values().stream().anyMatch(FundamentalsReport::degraded);
        return failures.isEmpty() && !anyDegraded ? RunStatus.SUCCEEDED : RunStatus.PARTIAL_SUCCESS;
    }
}
