package com.ifip.fundamentals.config;

import io.netty.channel.ChannelOption;
import java.time.Duration;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

/**
 * WebClients for the two SEC hosts. Both send the declared User-Agent, which SEC requires on
 * every request.
 */
@Configuration
public class SecClientConfig {

    private static final int MB = 1024 * 1024;

    @Bean
    @Qualifier("secDataWebClient")
    WebClient secDataWebClient(FundamentalsProperties properties) {
        // companyfacts for large filers run to tens of megabytes
        return secWebClient(properties, properties.getSecDataBaseUrl(), Math.max(8, properties.getSecDataMaxInMemoryMb()));
    }

    @Bean
    @Qualifier("secWwwWebClient")
    WebClient secWwwWebClient(FundamentalsProperties properties) {
        return secWebClient(properties, properties.getSecWwwBaseUrl(), 4);
    }

    private static WebClient secWebClient(FundamentalsProperties properties, String baseUrl, int maxInMemoryMb) {
        HttpClient httpClient = HttpClient.create()
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, properties.getConnectTimeoutMs())
            .responseTimeout(Duration.ofMillis(properties.getRequestTimeoutMs()))
            .compress(true);
        ExchangeStrategies strategies = ExchangeStrategies.builder()
            .codecs(codecs -> codecs.defaultCodecs().maxInMemorySize(maxInMemoryMb * MB))
            .build();
        return WebClient.builder()
            .baseUrl(baseUrl)
            .clientConnector(new ReactorClientHttpConnector(httpClient))
            .defaultHeader(HttpHeaders.USER_AGENT, properties.getUserAgent())
            .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
            .exchangeStrategies(strategies)
            .build();
    }
}
