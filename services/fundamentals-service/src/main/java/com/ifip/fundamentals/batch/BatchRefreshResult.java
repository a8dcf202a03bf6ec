package com.ifip.fundamentals.batch;

import com.ifip.fundamentals.domain.FundamentalsReport;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Snapshot of a batch refresh. Reports are keyed by ticker in submission order; tickers still
 * queued or running are listed in {@code pending}.
 */
public record BatchRefreshResult(
    UUID runId,
    RunStatus status,
    Instant startedAt,
    Instant completedAt,
    Map<String, FundamentalsReport> reports,
    Map<String, String> failures,
    List<String> cancelled,
    List<String> pending
) {
    public BatchRefreshResult {
        reports = Collections.unmodifiableMap(new LinkedHashMap<>(reports));
        failures = Collections.unmodifiableMap(new LinkedHashMap<>(failures));
        cancelled = List.copyOf(cancelled);
        pending = List.copyOf(pending);
    }

    public long degradedCount() {
        return reports.values().stream().filter(FundamentalsReport::degraded).count();
    }

    public boolean isDone() {
        return status != RunStatus.RUNNING;
    }
}
