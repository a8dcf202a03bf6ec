package com.ifip.fundamentals.ingestion;

import com.fasterxml.jackson.databind.JsonNode;
import com.ifip.fundamentals.client.CompanyFactsClient;
import com.ifip.fundamentals.domain.CompanyIdentity;
import com.ifip.fundamentals.domain.RawFactSet;
import java.time.Clock;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class FactsIngestor implements CompanyFactsProvider {

    private static final Logger LOGGER = LoggerFactory.getLogger(FactsIngestor.class);

    private final TickerDirectory tickerDirectory;
    private final CompanyFactsClient companyFactsClient;
    private final CompanyFactsNormalizer normalizer;
    private final Clock clock;

    public FactsIngestor(
        TickerDirectory tickerDirectory,
        CompanyFactsClient companyFactsClient,
        CompanyFactsNormalizer normalizer,
        Clock clock
    ) {
        this.tickerDirectory = tickerDirectory;
        this.companyFactsClient = companyFactsClient;
        this.normalizer = normalizer;
        this.clock = clock;
    }

    @Override
    public RawFactSet fetchCompanyFacts(String ticker) {
        CompanyIdentity company = tickerDirectory.resolve(ticker);
        long started = System.nanoTime();

        Optional<JsonNode> payload = companyFactsClient.fetchCompanyFacts(company.cik());
        if (payload.isEmpty()) {
            LOGGER.info("No XBRL facts published for {} (CIK {})", company.ticker(), company.cik());
            return new RawFactSet(company.ticker(), company.cik(), company.companyName(), List.of(), 0, clock.instant());
        }

        RawFactSet facts = normalizer.normalize(company, payload.get(), clock.instant());
        LOGGER.info(
            "Fetched {} facts for {} (CIK {}) in {}ms",
            facts.facts().size(),
            company.ticker(),
            company.cik(),
            (System.nanoTime() - started) / 1_000_000
        );
        return facts;
    }
}
