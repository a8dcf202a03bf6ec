package com.ifip.fundamentals.ingestion;

import com.fasterxml.jackson.databind.JsonNode;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.LoadingCache;
import com.ifip.fundamentals.client.CompanyFactsClient;
import com.ifip.fundamentals.config.FundamentalsProperties;
import com.ifip.fundamentals.domain.CompanyIdentity;
import com.ifip.fundamentals.exception.UnknownTickerException;
import com.ifip.fundamentals.exception.UpstreamUnavailableException;
import java.time.Duration;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Resolves exchange tickers to zero-padded SEC CIKs using the SEC ticker directory.
 */
@Component
public class TickerDirectory {

    private static final Logger LOGGER = LoggerFactory.getLogger(TickerDirectory.class);

    private static final String DIRECTORY_KEY = "company_tickers";

    // Used only while the directory itself cannot be fetched.
    private static final Map<String, CompanyIdentity> SEED = Map.of(
        "AAPL", new CompanyIdentity("AAPL", "0000320193", "Apple Inc."),
        "MSFT", new CompanyIdentity("MSFT", "0000789019", "MICROSOFT CORP"),
        "NVDA", new CompanyIdentity("NVDA", "0001045810", "NVIDIA CORP"),
        "GS", new CompanyIdentity("GS", "0000886982", "GOLDMAN SACHS GROUP INC")
    );

    private final CompanyFactsClient client;
    private final LoadingCache<String, Map<String, CompanyIdentity>> directory;

    public TickerDirectory(CompanyFactsClient client, FundamentalsProperties properties) {
        this.client = client;
        this.directory = Caffeine.newBuilder()
            .expireAfterWrite(Duration.ofHours(properties.getTickerDirectoryTtlHours()))
            .maximumSize(1)
            .build(key -> loadDirectory());
    }

    public CompanyIdentity resolve(String ticker) {
        String normalized = normalize(ticker);
        if (normalized.isEmpty()) {
            throw new IllegalArgumentException("Ticker must not be blank");
        }

        Map<String, CompanyIdentity> entries;
        try {
            entries = directory.get(DIRECTORY_KEY);
        } catch (UpstreamUnavailableException e) {
            CompanyIdentity seeded = SEED.get(normalized);
            if (seeded != null) {
                LOGGER.warn("Ticker directory unavailable, using built-in CIK for {}", normalized);
                return seeded;
            }
            throw e;
        }

        CompanyIdentity identity = entries.get(normalized);
        if (identity == null) {
            throw new UnknownTickerException(ticker);
        }
        return identity;
    }

    public void invalidate() {
        directory.invalidateAll();
    }

    public static String normalize(String ticker) {
        return ticker == null ? "" : ticker.trim().toUpperCase(Locale.ROOT).replace('.', '-');
    }

    private Map<String, CompanyIdentity> loadDirectory() {
        JsonNode root = client.fetchTickerDirectory();
        Map<String, CompanyIdentity> entries = new HashMap<>();
        Iterator<JsonNode> rows = root.elements();
        while (rows.hasNext()) {
            JsonNode row = rows.next();
            String ticker = normalize(row.path("ticker").asText(""));
            long cik = row.path("cik_str").asLong(-1);
            if (ticker.isEmpty() || cik <= 0) {
                continue;
            }
            // the directory lists a company's primary listing first; keep it
            entries.putIfAbsent(ticker, new CompanyIdentity(ticker, String.format("%010d", cik), row.path("title").asText("").trim()));
        }
        LOGGER.info("Loaded {} tickers from SEC directory", entries.size());
        return Map.copyOf(entries);
    }
}
