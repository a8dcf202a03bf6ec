package com.ifip.fundamentals.batch;

import com.ifip.fundamentals.config.FundamentalsProperties;
import java.time.Duration;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
public class FundamentalsRefreshScheduler {

    private static final Logger LOGGER = LoggerFactory.getLogger(FundamentalsRefreshScheduler.class);

    private final FundamentalsProperties properties;
    private final FundamentalsBatchService batchService;

    public FundamentalsRefreshScheduler(FundamentalsProperties properties, FundamentalsBatchService batchService) {
        this.properties = properties;
        this.batchService = batchService;
    }

    @Scheduled(fixedDelayString = "${fundamentals.scheduler-fixed-delay-ms:86400000}")
    public void runScheduledRefresh() {
        if (!properties.isSchedulerEnabled()) {
            return;
        }
        List<String> tickers = properties.getDefaultTickers();
        if (tickers == null || tickers.isEmpty()) {
            LOGGER.warn("Scheduler enabled but no default tickers configured");
            return;
        }
        LOGGER.info("Running scheduled refresh for {} tickers", tickers.size());
        BatchRefresh batch = batchService.refresh(tickers);
        try {
            BatchRefreshResult result = batch.await(Duration.ofMillis(properties.getSchedulerFixedDelayMs()));
            if (!result.isDone()) {
                LOGGER.warn("Scheduled refresh {} still has {} tickers pending, cancelling", batch.runId(), result.pending().size());
                batch.cancel();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            batch.cancel();
        }
    }
}
