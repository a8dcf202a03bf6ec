package com.ifip.fundamentals.service;

import com.ifip.fundamentals.domain.CompanyIdentity;
import com.ifip.fundamentals.domain.FundamentalsReport;
import com.ifip.fundamentals.domain.QualityReport;
import com.ifip.fundamentals.domain.RawFactSet;
import com.ifip.fundamentals.domain.Warning;
import com.ifip.fundamentals.exception.MalformedPayloadException;
import com.ifip.fundamentals.exception.UpstreamUnavailableException;
import com.ifip.fundamentals.ingestion.CompanyFactsProvider;
import com.ifip.fundamentals.ingestion.FactCache;
import com.ifip.fundamentals.ingestion.TickerDirectory;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Entry point for per-ticker fundamentals.
 *
 * <p>Fact sets are read through {@link FactCache}. When the provider stays unavailable after
 * retries the caller still gets a report, marked degraded and graded F; such reports are never
 * cached. Only an unknown ticker, a blank ticker or a cancelled fetch surfaces as an exception.
 */
@Service
public class FundamentalsService {

    private static final Logger LOGGER = LoggerFactory.getLogger(FundamentalsService.class);

    private final CompanyFactsProvider provider;
    private final FactCache factCache;
    private final FundamentalsReportAssembler assembler;

    public FundamentalsService(CompanyFactsProvider provider, FactCache factCache, FundamentalsReportAssembler assembler) {
        this.provider = provider;
        this.factCache = factCache;
        this.assembler = assembler;
    }

    public FundamentalsReport getFundamentals(String ticker) {
        String normalized = requireTicker(ticker);
        try {
            RawFactSet facts = factCache.get(normalized, provider::fetchCompanyFacts);
            return assembler.assemble(facts);
        } catch (UpstreamUnavailableException | MalformedPayloadException e) {
            LOGGER.warn("Returning degraded report for {}: {}", normalized, e.getMessage());
            return assembler.degraded(new CompanyIdentity(normalized, null, null), e.getMessage());
        }
    }

    public QualityReport getQualityReport(String ticker) {
        return getFundamentals(ticker).quality();
    }

    public List<Warning> listDataQualityWarnings(String ticker) {
        return getFundamentals(ticker).warnings();
    }

    /**
     * Drops the cached fact set and builds the report from a fresh fetch. A fetch for the same
     * ticker that is already running is joined rather than repeated.
     */
    public FundamentalsReport refresh(String ticker) {
        String normalized = requireTicker(ticker);
        factCache.invalidate(normalized);
        LOGGER.info("Refreshing fundamentals for {}", normalized);
        return getFundamentals(normalized);
    }

    private static String requireTicker(String ticker) {
        String normalized = TickerDirectory.normalize(ticker);
        if (normalized.isEmpty()) {
            throw new IllegalArgumentException("Ticker must not be blank");
        }
        return normalized;
    }
}
