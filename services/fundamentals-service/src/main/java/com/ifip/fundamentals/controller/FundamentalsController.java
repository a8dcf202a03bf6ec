package com.ifip.fundamentals.controller;

import com.ifip.fundamentals.batch.BatchRefresh;
import com.ifip.fundamentals.batch.FundamentalsBatchService;
import com.ifip.fundamentals.domain.FundamentalsReport;
import com.ifip.fundamentals.domain.QualityReport;
import com.ifip.fundamentals.domain.Warning;
import com.ifip.fundamentals.service.FundamentalsService;
import jakarta.validation.Valid;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/fundamentals")
public class FundamentalsController {

    private final FundamentalsService fundamentalsService;
    private final FundamentalsBatchService batchService;

    public FundamentalsController(FundamentalsService fundamentalsService, FundamentalsBatchService batchService) {
        this.fundamentalsService = fundamentalsService;
        this.batchService = batchService;
    }

    @GetMapping("/{ticker}")
    public FundamentalsReport getFundamentals(@PathVariable String ticker) {
        return fundamentalsService.getFundamentals(ticker);
    }

    @GetMapping("/{ticker}/quality")
    public QualityReport getQualityReport(@PathVariable String ticker) {
        return fundamentalsService.getQualityReport(ticker);
    }

    @GetMapping("/{ticker}/warnings")
    public List<Warning> listWarnings(@PathVariable String ticker) {
        return fundamentalsService.listDataQualityWarnings(ticker);
    }

    @PostMapping("/refresh")
    public ResponseEntity<Map<String, Object>> refresh(@Valid @RequestBody RefreshRequest request) {
        BatchRefresh batch = batchService.refresh(request.tickers());
        return ResponseEntity.accepted().body(Map.of("runId", batch.runId()));
    }

    @GetMapping("/refresh/runs/{runId}")
    public RefreshRunResponse getRun(@PathVariable UUID runId) {
        return RefreshRunResponse.from(findRun(runId).snapshot());
    }

    @PostMapping("/refresh/runs/{runId}/cancel")
    public RefreshRunResponse cancelRun(@PathVariable UUID runId) {
        BatchRefresh batch = findRun(runId);
        batch.cancel();
        return RefreshRunResponse.from(batch.snapshot());
    }

    private BatchRefresh findRun(UUID runId) {
        return batchService.findRun(runId)
            .orElseThrow(() -> new IllegalArgumentException("Run not found: " + runId));
    }
}
