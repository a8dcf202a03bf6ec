package com.ifip.fundamentals.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.ifip.fundamentals.config.FundamentalsProperties;
import com.ifip.fundamentals.exception.FundamentalsException;
import com.ifip.fundamentals.exception.IngestionCancelledException;
import com.ifip.fundamentals.exception.MalformedPayloadException;
import com.ifip.fundamentals.exception.RateLimitedException;
import com.ifip.fundamentals.exception.UpstreamUnavailableException;
import java.time.Duration;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Optional;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.codec.DecodingException;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.Exceptions;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

@Component
public class SecEdgarClient implements CompanyFactsClient {

    private static final Logger LOGGER = LoggerFactory.getLogger(SecEdgarClient.class);

    private static final Duration MAX_RETRY_AFTER = Duration.ofSeconds(30);

    private final WebClient secDataWebClient;
    private final WebClient secWwwWebClient;
    private final Semaphore permits;
    private final Duration requestTimeout;
    private final Retry retrySpec;

    public SecEdgarClient(
        @Qualifier("secDataWebClient") WebClient secDataWebClient,
        @Qualifier("secWwwWebClient") WebClient secWwwWebClient,
        FundamentalsProperties properties
    ) {
        this.secDataWebClient = secDataWebClient;
        this.secWwwWebClient = secWwwWebClient;
        this.permits = new Semaphore(Math.max(1, properties.getMaxConcurrentRequests()), true);
        this.requestTimeout = Duration.ofMillis(properties.getRequestTimeoutMs());
        this.retrySpec = retrySpec(
            properties.getMaxAttempts(),
            Duration.ofMillis(properties.getInitialBackoffMs()),
            Duration.ofMillis(properties.getMaxBackoffMs())
        );
    }

    @Override
    public JsonNode fetchTickerDirectory() {
        Mono<JsonNode> request = secWwwWebClient.get()
            .uri("/files/company_tickers.json")
            .retrieve()
            .bodyToMono(JsonNode.class);

        JsonNode root = execute("company_tickers.json", request);
        if (root == null || !root.isObject()) {
            throw new MalformedPayloadException("Ticker directory payload is empty");
        }
        return root;
    }

    @Override
    public Optional<JsonNode> fetchCompanyFacts(String cik) {
        String paddedCik = String.format("%010d", Long.parseLong(cik));

        Mono<JsonNode> request = secDataWebClient.get()
            .uri(uriBuilder -> uriBuilder.path("/api/xbrl/companyfacts/CIK" + paddedCik + ".json").build())
            .retrieve()
            .bodyToMono(JsonNode.class)
            .onErrorResume(WebClientResponseException.NotFound.class, ex -> Mono.empty());

        return Optional.ofNullable(execute("companyfacts CIK" + paddedCik, request));
    }

    private JsonNode execute(String resource, Mono<JsonNode> request) {
        Mono<JsonNode> guarded = request
            .timeout(requestTimeout)
            .onErrorMap(error -> translate(resource, error))
            .retryWhen(retrySpec);

        try {
            permits.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IngestionCancelledException(resource, e);
        }
        try {
            return guarded.block();
        } catch (FundamentalsException e) {
            throw e;
        } catch (RuntimeException e) {
            // block() wraps the interrupt of a cancelled batch worker after disposing the exchange
            Throwable cause = Exceptions.unwrap(e);
            if (cause instanceof InterruptedException) {
                Thread.currentThread().interrupt();
                throw new IngestionCancelledException(resource, cause);
            }
            throw new UpstreamUnavailableException("Request for " + resource + " failed: " + e.getMessage(), e, false);
        } finally {
            permits.release();
        }
    }

    static Retry retrySpec(int maxAttempts, Duration initialBackoff, Duration maxBackoff) {
        return Retry.backoff(Math.max(0, maxAttempts - 1), initialBackoff)
            .maxBackoff(maxBackoff)
            .filter(SecEdgarClient::isRetryable)
            .doBeforeRetryAsync(signal -> retryAfterDelay(signal.failure()))
            .doBeforeRetry(signal -> LOGGER.warn(
                "Retrying SEC request, attempt {}: {}",
                signal.totalRetries() + 2,
                signal.failure().getMessage()
            ))
            .onRetryExhaustedThrow((retrySpec, signal) -> signal.failure());
    }

    private static boolean isRetryable(Throwable error) {
        return error instanceof UpstreamUnavailableException upstream && upstream.isRetryable();
    }

    private static Mono<Void> retryAfterDelay(Throwable error) {
        if (error instanceof RateLimitedException rateLimited) {
            return rateLimited.getRetryAfter()
                .map(delay -> Mono.delay(delay).then())
                .orElse(Mono.empty());
        }
        return Mono.empty();
    }

    private Throwable translate(String resource, Throwable error) {
        if (error instanceof FundamentalsException) {
            return error;
        }
        if (error instanceof WebClientResponseException response) {
            int status = response.getStatusCode().value();
            if (status == HttpStatus.TOO_MANY_REQUESTS.value()) {
                return new RateLimitedException(
                    "SEC rate limit hit for " + resource,
                    parseRetryAfter(response.getHeaders().getFirst(HttpHeaders.RETRY_AFTER))
                );
            }
            boolean retryable = response.getStatusCode().is5xxServerError();
            return new UpstreamUnavailableException("SEC responded " + status + " for " + resource, response, retryable);
        }
        if (error instanceof TimeoutException) {
            return new UpstreamUnavailableException(
                "SEC request for " + resource + " timed out after " + requestTimeout.toMillis() + "ms", error);
        }
        if (error instanceof WebClientRequestException) {
            return new UpstreamUnavailableException("SEC unreachable for " + resource + ": " + error.getMessage(), error);
        }
        if (error instanceof DecodingException) {
            return new MalformedPayloadException("Unreadable payload for " + resource, error);
        }
        return error;
    }

    static Duration parseRetryAfter(String header) {
        if (header == null || header.isBlank()) {
            return null;
        }
        Duration delay;
        try {
            delay = Duration.ofSeconds(Long.parseLong(header.trim()));
        } catch (NumberFormatException notSeconds) {
            try {
                ZonedDateTime at = ZonedDateTime.parse(header.trim(), DateTimeFormatter.RFC_1123_DATE_TIME);
                delay = Duration.between(ZonedDateTime.now(at.getZone()), at);
            } catch (DateTimeParseException unparseable) {
                LOGGER.debug("Ignoring unparseable Retry-After header '{}'", header);
                return null;
            }
        }
        if (delay.isNegative()) {
            return Duration.ZERO;
        }
        return delay.compareTo(MAX_RETRY_AFTER) > 0 ? MAX_RETRY_AFTER : delay;
    }
}
