package com.ifip.fundamentals.ingestion;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ifip.fundamentals.domain.CompanyIdentity;
import com.ifip.fundamentals.domain.RawFact;
import com.ifip.fundamentals.domain.RawFactSet;
import java.time.Instant;
import java.time.LocalDate;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("CompanyFactsNormalizer")
class CompanyFactsNormalizerTest {

    private static final CompanyIdentity APPLE = new CompanyIdentity("AAPL", "0000320193", "Apple Inc.");
    private static final Instant NOW = Instant.parse("2024-02-15T00:00:00Z");

    private final ObjectMapper objectMapper = new ObjectMapper();
    private CompanyFactsNormalizer normalizer;

    @BeforeEach
    void setUp() {
        normalizer = new CompanyFactsNormalizer();
    }

    @Test
    @DisplayName("should flatten SEC companyfacts across taxonomies and units")
    void normalize_secShape() throws Exception {
        // Given
        JsonNode payload = objectMapper.readTree("""
            {
              "cik": 320193,
              "entityName": "Apple Inc.",
              "facts": {
                "dei": {
                  "EntityCommonStockSharesOutstanding": {
                    "units": {"shares": [{"end": "2024-01-19", "val": 15441881000, "filed": "2024-02-02", "form": "10-Q"}]}
                  }
                },
                "us-gaap": {
                  "Revenues": {
                    "units": {
                      "USD": [
                        {"start": "2023-07-02", "end": "2023-09-30", "val": 89498000000, "accn": "0000320193-23-000106",
                         "fy": 2023, "fp": "FY", "form": "10-K", "filed": "2023-11-03"},
                        {"end": "2023-12-30", "val": 119575000000, "fy": 2024, "fp": "Q1", "form": "10-Q", "filed": "2024-02-02"}
                      ]
                    }
                  },
                  "EarningsPerShareDiluted": {
                    "units": {"USD/shares": [{"start": "2023-10-01", "end": "2023-12-30", "val": 2.18, "form": "10-Q", "filed": "2024-02-02"}]}
                  }
                },
                "ifrs-full": {
                  "Revenue": {
                    "units": {"USD": [{"start": "2023-01-01", "end": "2023-12-31", "val": 10, "form": "20-F", "filed": "2024-03-01"}]}
                  }
                }
              }
            }
            """);

        // When
        RawFactSet set = normalizer.normalize(APPLE, payload, NOW);

        // Then
        assertThat(set.facts()).hasSize(4);
        assertThat(set.droppedEntries()).isZero();
        assertThat(set.fetchedAt()).isEqualTo(NOW);
        RawFact annual = set.facts().stream().filter(f -> "10-K".equals(f.formType())).findFirst().orElseThrow();
        assertThat(annual.concept()).isEqualTo("Revenues");
        assertThat(annual.unit()).isEqualTo("USD");
        assertThat(annual.value()).isEqualTo(89_498_000_000.0);
        assertThat(annual.periodStart()).isEqualTo(LocalDate.parse("2023-07-02"));
        assertThat(annual.fiscalYear()).isEqualTo(2023);
        assertThat(annual.fiscalPeriod()).isEqualTo("FY");
        assertThat(annual.accessionNo()).isEqualTo("0000320193-23-000106");
        assertThat(set.facts()).extracting(RawFact::concept).contains("EarningsPerShareDiluted", "Revenue");
        assertThat(set.facts()).extracting(RawFact::concept).doesNotContain("EntityCommonStockSharesOutstanding");
    }

    @Test
    @DisplayName("should read the flat proxy shape with either val or value")
    void normalize_flatShape() throws Exception {
        JsonNode payload = objectMapper.readTree("""
            {"facts": [
              {"concept": "NetIncomeLoss", "unit": "USD", "val": 10, "start": "2023-01-01", "end": "2023-03-31", "filed": "2023-05-01", "form": "10-Q"},
              {"concept": "Assets", "unit": "USD", "value": 500, "end": "2023-03-31", "filed": "2023-05-01", "form": "10-Q"}
            ]}
            """);

        RawFactSet set = normalizer.normalize(APPLE, payload, NOW);

        assertThat(set.facts()).extracting(RawFact::value).containsExactly(10.0, 500.0);
        assertThat(set.facts().get(1).hasDuration()).isFalse();
        assertThat(set.companyName()).isEqualTo("Apple Inc.");
    }

    @Test
    @DisplayName("should drop malformed entries one by one and keep the rest")
    void normalize_dropsMalformedEntries() throws Exception {
        // Given
        JsonNode payload = objectMapper.readTree("""
            {"facts": [
              {"concept": "Revenues", "unit": "USD", "val": 10, "end": "2023-03-31", "filed": "2023-05-01", "form": "10-Q"},
              {"concept": "Revenues", "unit": "USD", "val": "n/a", "end": "2023-03-31", "filed": "2023-05-01", "form": "10-Q"},
              {"concept": "Revenues", "unit": "USD", "val": 10, "end": "31/03/2023", "filed": "2023-05-01", "form": "10-Q"},
              {"concept": "Revenues", "unit": "USD", "val": 10, "end": "2023-03-31", "form": "10-Q"},
              {"concept": "Revenues", "unit": "USD", "val": 10, "start": "2023-04-01", "end": "2023-03-31", "filed": "2023-05-01", "form": "10-Q"},
              {"concept": "Revenues", "unit": "USD", "val": 10, "end": "2023-03-31", "filed": "2023-05-01"},
              {"unit": "USD", "val": 10, "end": "2023-03-31", "filed": "2023-05-01", "form": "10-Q"},
              {"concept": "Revenues", "val": 10, "end": "2023-03-31", "filed": "2023-05-01", "form": "10-Q"}
            ]}
            """);

        // When
        RawFactSet set = normalizer.normalize(APPLE, payload, NOW);

        // Then
        assertThat(set.facts()).hasSize(1);
        assertThat(set.droppedEntries()).isEqualTo(7);
    }

    @Test
    @DisplayName("should return an empty set when the payload has no facts")
    void normalize_withoutFacts_isEmpty() throws Exception {
        RawFactSet set = normalizer.normalize(APPLE, objectMapper.readTree("{\"cik\": 320193}"), NOW);

        assertThat(set.isEmpty()).isTrue();
        assertThat(set.ticker()).isEqualTo("AAPL");
        assertThat(set.cik()).isEqualTo("0000320193");
    }
}
