package com.ifip.fundamentals.ingestion;

import com.ifip.fundamentals.domain.RawFactSet;

/**
 * Source of a company's raw reported facts. The engine does not care whether the facts come
 * straight from SEC EDGAR or from a proxy financial-data API.
 *
 * @throws com.ifip.fundamentals.exception.UnknownTickerException when the ticker cannot be resolved
 * @throws com.ifip.fundamentals.exception.UpstreamUnavailableException when the provider gave up
 */
public interface CompanyFactsProvider {

    RawFactSet fetchCompanyFacts(String ticker);
}
