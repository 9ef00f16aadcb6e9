package com.copas.services.ordercrm.config;

import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import io.netty.handler.timeout.WriteTimeoutHandler;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeFilterFunction;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;

import java.util.concurrent.TimeUnit;

/**
 * WebClient configuration for WhatsApp Cloud API calls.
 * Direct Meta Cloud API integration (no BSP)
 */
@Configuration
@Slf4j
public class WebClientConfig {

    /**
     * WebClient pre-configured for the Graph API.
     * Base URL: https://graph.facebook.com/v18.0
     *
     * Timeouts:
     * - Connect: 10s
     * - Response/read/write: whatsapp.send-timeout (30s default)
     */
    @Bean(name = "whatsAppWebClient")
    public WebClient whatsAppWebClient(WhatsAppProperties properties) {
        return buildWhatsAppWebClient(properties);
    }

    /**
     * Shared builder so the client can be wired by hand in tests.
     */
    public static WebClient buildWhatsAppWebClient(WhatsAppProperties properties) {
        long timeoutMillis = properties.getSendTimeout().toMillis();

        HttpClient httpClient = HttpClient.create()
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, 10_000)
                .responseTimeout(properties.getSendTimeout())
                .doOnConnected(conn ->
                        conn.addHandlerLast(new ReadTimeoutHandler(timeoutMillis, TimeUnit.MILLISECONDS))
                                .addHandlerLast(new WriteTimeoutHandler(timeoutMillis, TimeUnit.MILLISECONDS))
                );

        return WebClient.builder()
                .baseUrl(properties.getVersionedBaseUrl())
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .filter(logRequest())
                .filter(logResponse())
                .build();
    }

    private static ExchangeFilterFunction logRequest() {
        return ExchangeFilterFunction.ofRequestProcessor(clientRequest -> {
            log.debug("-> WhatsApp API Request: {} {}", clientRequest.method(), clientRequest.url());
            return Mono.just(clientRequest);
        });
    }

    private static ExchangeFilterFunction logResponse() {
        return ExchangeFilterFunction.ofResponseProcessor(clientResponse -> {
            log.debug("<- WhatsApp API Response: {}", clientResponse.statusCode());
            return Mono.just(clientResponse);
        });
    }
}
