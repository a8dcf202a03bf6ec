package com.ifip.fundamentals.controller;

import com.ifip.fundamentals.batch.BatchRefreshResult;
import com.ifip.fundamentals.batch.RunStatus;
import com.ifip.fundamentals.domain.Grade;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

public record RefreshRunResponse(
    UUID runId,
    RunStatus status,
    Instant startedAt,
    Instant completedAt,
    Map<String, Grade> grades,
    List<String> degraded,
    Map<String, String> failures,
    List<String> cancelled,
    List<String> pending
) {

    static RefreshRunResponse from(BatchRefreshResult result) {
        Map<String, Grade> grades = new LinkedHashMap<>();
        result.reports().forEach((ticker, report) -> grades.put(ticker, report.quality().grade()));
        List<String> degraded = result.reports().entrySet().stream()
            .filter(e -> e.getValue().degraded())
            .map(Map.Entry::getKey)
            .toList();
        return new RefreshRunResponse(
            result.runId(),
            result.status(),
            result.startedAt(),
            result.completedAt(),
            grades,
            degraded,
            result.failures(),
            result.cancelled(),
            result.pending()
        );
    }
}
