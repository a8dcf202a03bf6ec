package com.ifip.fundamentals.client;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Optional;

/**
 * Raw transport to the facts provider. Implementations retry transient failures themselves and
 * throw {@link com.ifip.fundamentals.exception.UpstreamUnavailableException} once they give up.
 */
public interface CompanyFactsClient {

    /**
     * Ticker directory keyed by arbitrary index, each entry carrying {@code cik_str}, {@code ticker}
     * and {@code title}.
     */
    JsonNode fetchTickerDirectory();

    /**
     * Company facts payload for a CIK, or empty when the provider holds no XBRL facts for it.
     */
    Optional<JsonNode> fetchCompanyFacts(String cik);
}
