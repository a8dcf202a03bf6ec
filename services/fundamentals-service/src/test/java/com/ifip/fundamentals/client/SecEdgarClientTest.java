package com.ifip.fundamentals.client;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonNode;
import com.ifip.fundamentals.config.FundamentalsProperties;
import com.ifip.fundamentals.exception.MalformedPayloadException;
import com.ifip.fundamentals.exception.RateLimitedException;
import com.ifip.fundamentals.exception.UpstreamUnavailableException;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

@DisplayName("SecEdgarClient")
class SecEdgarClientTest {

    private final Deque<ClientResponse> responses = new ArrayDeque<>();
    private final List<String> requestedPaths = new ArrayList<>();
    private SecEdgarClient client;

    @BeforeEach
    void setUp() {
        FundamentalsProperties properties = new FundamentalsProperties();
        properties.setMaxAttempts(3);
        properties.setInitialBackoffMs(1);
        properties.setMaxBackoffMs(5);
        properties.setRequestTimeoutMs(2_000);

        WebClient stub = WebClient.builder()
            .baseUrl("https://data.sec.test")
            .exchangeFunction(request -> {
                requestedPaths.add(request.url().getPath());
                ClientResponse next = responses.poll();
                return next == null ? Mono.error(new IllegalStateException("no response queued")) : Mono.just(next);
            })
            .build();
        client = new SecEdgarClient(stub, stub, properties);
    }

    private static ClientResponse json(HttpStatus status, String body) {
        return ClientResponse.create(status)
            .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
            .body(body)
            .build();
    }

    @Nested
    @DisplayName("companyfacts")
    class CompanyFacts {

        @Test
        @DisplayName("should request the zero-padded CIK document")
        void fetchCompanyFacts_padsCik() {
            // Given
            responses.add(json(HttpStatus.OK, "{\"cik\": 320193, \"entityName\": \"Apple Inc.\", \"facts\": {}}"));

            // When
            Optional<JsonNode> payload = client.fetchCompanyFacts("320193");

            // Then
            assertThat(payload).isPresent();
            assertThat(payload.get().path("entityName").asText()).isEqualTo("Apple Inc.");
            assertThat(requestedPaths).containsExactly("/api/xbrl/companyfacts/CIK0000320193.json");
        }

        @Test
        @DisplayName("should treat 404 as a company without XBRL facts")
        void fetchCompanyFacts_notFound_isEmpty() {
            responses.add(json(HttpStatus.NOT_FOUND, "{}"));

            assertThat(client.fetchCompanyFacts("0000320193")).isEmpty();
            assertThat(requestedPaths).hasSize(1);
        }

        @Test
        @DisplayName("should give up after three attempts on server errors")
        void fetchCompanyFacts_serverErrors_exhaustRetries() {
            // Given
            for (int i = 0; i < 5; i++) {
                responses.add(json(HttpStatus.SERVICE_UNAVAILABLE, "{}"));
            }

            // When / Then
            assertThatThrownBy(() -> client.fetchCompanyFacts("0000320193"))
                .isInstanceOf(UpstreamUnavailableException.class)
                .hasMessageContaining("503");
            assertThat(requestedPaths).hasSize(3);
        }

        @Test
        @DisplayName("should recover when a retry succeeds")
        void fetchCompanyFacts_recoversOnRetry() {
            responses.add(json(HttpStatus.BAD_GATEWAY, "{}"));
            responses.add(json(HttpStatus.OK, "{\"facts\": {}}"));

            assertThat(client.fetchCompanyFacts("0000320193")).isPresent();
            assertThat(requestedPaths).hasSize(2);
        }

        @Test
        @DisplayName("should not retry client errors")
        void fetchCompanyFacts_clientError_isNotRetried() {
            responses.add(json(HttpStatus.FORBIDDEN, "{}"));

            assertThatThrownBy(() -> client.fetchCompanyFacts("0000320193"))
                .isInstanceOfSatisfying(UpstreamUnavailableException.class, e -> assertThat(e.isRetryable()).isFalse());
            assertThat(requestedPaths).hasSize(1);
        }

        @Test
        @DisplayName("should honour Retry-After on 429 and retry")
        void fetchCompanyFacts_rateLimited_retries() {
            responses.add(ClientResponse.create(HttpStatus.TOO_MANY_REQUESTS)
                .header(HttpHeaders.RETRY_AFTER, "0")
                .build());
            responses.add(json(HttpStatus.OK, "{\"facts\": {}}"));

            assertThat(client.fetchCompanyFacts("0000320193")).isPresent();
            assertThat(requestedPaths).hasSize(2);
        }

        @Test
        @DisplayName("should surface RateLimited once retries are exhausted")
        void fetchCompanyFacts_rateLimited_exhausted() {
            for (int i = 0; i < 3; i++) {
                responses.add(ClientResponse.create(HttpStatus.TOO_MANY_REQUESTS).header(HttpHeaders.RETRY_AFTER, "0").build());
            }

            assertThatThrownBy(() -> client.fetchCompanyFacts("0000320193"))
                .isInstanceOfSatisfying(RateLimitedException.class,
                    e -> assertThat(e.getRetryAfter()).contains(Duration.ZERO));
        }
    }

    @Nested
    @DisplayName("ticker directory")
    class TickerDirectoryDocument {

        @Test
        @DisplayName("should reject a payload that is not a JSON object")
        void fetchTickerDirectory_rejectsArray() {
            responses.add(json(HttpStatus.OK, "[]"));

            assertThatThrownBy(() -> client.fetchTickerDirectory()).isInstanceOf(MalformedPayloadException.class);
            assertThat(requestedPaths).containsExactly("/files/company_tickers.json");
        }
    }

    @Nested
    @DisplayName("Retry-After parsing")
    class RetryAfter {

        @Test
        void parseRetryAfter_seconds() {
            assertThat(SecEdgarClient.parseRetryAfter("5")).isEqualTo(Duration.ofSeconds(5));
        }

        @Test
        void parseRetryAfter_capsLongDelays() {
            assertThat(SecEdgarClient.parseRetryAfter("600")).isEqualTo(Duration.ofSeconds(30));
        }

        @Test
        void parseRetryAfter_pastDate_isZero() {
            assertThat(SecEdgarClient.parseRetryAfter("Wed, 21 Oct 2015 07:28:00 GMT")).isEqualTo(Duration.ZERO);
        }

        @Test
        void parseRetryAfter_garbage_isNull() {
            assertThat(SecEdgarClient.parseRetryAfter("soon")).isNull();
            assertThat(SecEdgarClient.parseRetryAfter(null)).isNull();
        }
    }
}
