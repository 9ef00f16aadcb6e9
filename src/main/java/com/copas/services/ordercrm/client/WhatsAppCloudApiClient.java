package com.copas.services.ordercrm.client;

import com.copas.services.ordercrm.config.WhatsAppProperties;
import com.copas.services.ordercrm.constants.OrderCrmConstants;
import com.copas.services.ordercrm.dto.response.WhatsAppMessageResponse;
import com.copas.services.ordercrm.exception.WhatsAppApiException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.ratelimiter.RequestNotPermitted;
import io.github.resilience4j.ratelimiter.annotation.RateLimiter;
import io.netty.handler.timeout.ReadTimeoutException;
import io.netty.handler.timeout.WriteTimeoutException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatusCode;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.Exceptions;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * HTTP client for the WhatsApp Cloud API (Meta Graph API), template messages only.
 *
 * Resilience strategy (outermost → innermost):
 *   CircuitBreaker → RateLimiter → actual HTTP call
 *
 *   1. CircuitBreaker: opens after 50% failure rate; stays open 30s
 *   2. RateLimiter   : caps outbound sends (configured in YAML)
 *
 * This is Resilience4j's default aspect order, so a RequestNotPermitted from
 * the limiter reaches the circuit breaker's fallback.
 *
 * There is deliberately no @Retry here: a send that timed out may still have
 * been delivered, and replaying it would message the customer twice.
 *
 * Every call is bounded by whatsapp.send-timeout. All failures surface as
 * WhatsAppApiException with a human-readable detail ("HTTP 400: ...").
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class WhatsAppCloudApiClient {

    @Qualifier("whatsAppWebClient")
    private final WebClient webClient;
    private final WhatsAppProperties properties;
    private final ObjectMapper objectMapper;

    private static final String CB_NAME = "whatsAppApi";

    private static final int MAX_ERROR_BODY_LENGTH = 500;

    /**
     * Send the configured template to one recipient.
     *
     * @param to             destination in international digits-only form (e.g. 573001234567)
     * @param bodyParameters positional {{1}}, {{2}}, ... values of the template body
     * @return provider message id (wamid...)
     */
    @CircuitBreaker(name = CB_NAME, fallbackMethod = "fallbackSendTemplateMessage")
    @RateLimiter(name = CB_NAME)
    public String sendTemplateMessage(String to, List<String> bodyParameters) {
        log.info("Sending WhatsApp template: template={}, to={}", properties.getTemplateName(), mask(to));
        try {
            WhatsAppMessageResponse response = webClient.post()
                    .uri("/{phoneNumberId}/messages", properties.getPhoneNumberId())
                    .header(HttpHeaders.AUTHORIZATION, "Bearer " + properties.getAccessToken())
                    .bodyValue(buildTemplateBody(to, bodyParameters))
                    .retrieve()
                    .onStatus(HttpStatusCode::is4xxClientError, res ->
                            res.bodyToMono(String.class)
                                    .defaultIfEmpty("")
                                    .map(body -> new WhatsAppApiException.ClientException(
                                            describeHttpError(res.statusCode().value(), body),
                                            res.statusCode().value())))
                    .onStatus(HttpStatusCode::is5xxServerError, res ->
                            res.bodyToMono(String.class)
                                    .defaultIfEmpty("")
                                    .map(body -> new WhatsAppApiException(
                                            describeHttpError(res.statusCode().value(), body),
                                            res.statusCode().value())))
                    .bodyToMono(WhatsAppMessageResponse.class)
                    .timeout(properties.getSendTimeout())
                    .block();

            return extractMessageId(response);
        } catch (WebClientResponseException ex) {
            throw mapWebClientException(ex);
        } catch (WebClientRequestException ex) {
            throw mapTransportException(ex);
        } catch (WhatsAppApiException ex) {
            throw ex;
        } catch (RuntimeException ex) {
            if (Exceptions.unwrap(ex) instanceof TimeoutException) {
                throw WhatsAppApiException.timeout(properties.getSendTimeout());
            }
            throw new WhatsAppApiException("Unexpected WhatsApp API failure: " + ex.getMessage(), ex);
        }
    }

    // ======================================================
    // FALLBACK
    // ======================================================

    /**
     * Fallback for sendTemplateMessage.
     * Triggered on every failure: only an open circuit or an exhausted rate limit
     * are translated, provider errors keep their own detail.
     */
    private String fallbackSendTemplateMessage(String to, List<String> bodyParameters, Throwable ex) {
        if (ex instanceof CallNotPermittedException) {
            log.error("Circuit OPEN: WhatsApp API calls are blocked for now");
            throw WhatsAppApiException.serviceUnavailable();
        }
        if (ex instanceof RequestNotPermitted) {
            log.warn("WhatsApp send rate limit reached");
            throw new WhatsAppApiException("WhatsApp send rate limit reached", 429);
        }
        if (ex instanceof WhatsAppApiException apiException) {
            throw apiException;
        }
        throw new WhatsAppApiException("Unexpected WhatsApp API failure: " + ex.getMessage(), ex);
    }

    // ======================================================
    // PRIVATE HELPERS
    // ======================================================

    private Map<String, Object> buildTemplateBody(String to, List<String> bodyParameters) {
        List<Map<String, Object>> parameters = new ArrayList<>();
        for (String value : bodyParameters) {
            parameters.add(Map.of("type", "text", "text", value));
        }

        Map<String, Object> template = new LinkedHashMap<>();
        template.put("name", properties.getTemplateName());
        template.put("language", Map.of("code", properties.getTemplateLanguage()));
        template.put("components", List.of(Map.of("type", "body", "parameters", parameters)));

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("messaging_product", OrderCrmConstants.META_MESSAGING_PRODUCT);
        body.put("to", to);
        body.put("type", OrderCrmConstants.META_MESSAGE_TYPE_TEMPLATE);
        body.put("template", template);
        return body;
    }

    private String extractMessageId(WhatsAppMessageResponse response) {
        if (response == null) {
            throw new WhatsAppApiException("Malformed WhatsApp API response: empty body", 502);
        }
        if (response.getError() != null) {
            throw new WhatsAppApiException("WhatsApp API error: " + response.getErrorMessage(), 502);
        }
        String messageId = response.getFirstMessageId();
        if (messageId == null) {
            throw new WhatsAppApiException("Malformed WhatsApp API response: no message id", 502);
        }
        log.info("WhatsApp template accepted: messageId={}", messageId);
        return messageId;
    }

    /**
     * "HTTP 400: (#131030) Recipient phone number not in allowed list"
     */
    private String describeHttpError(int status, String body) {
        return "HTTP " + status + ": " + providerMessage(body);
    }

    private String providerMessage(String body) {
        if (body == null || body.isBlank()) return "no response body";
        try {
            String message = objectMapper.readValue(body, WhatsAppMessageResponse.class).getErrorMessage();
            if (message != null) return message;
        } catch (JsonProcessingException ex) {
            log.debug("WhatsApp error body is not JSON: {}", ex.getOriginalMessage());
        }
        String trimmed = body.trim();
        return trimmed.length() > MAX_ERROR_BODY_LENGTH
                ? trimmed.substring(0, MAX_ERROR_BODY_LENGTH) + "..."
                : trimmed;
    }

    private WhatsAppApiException mapWebClientException(WebClientResponseException ex) {
        int status = ex.getStatusCode().value();
        String detail = describeHttpError(status, ex.getResponseBodyAsString());
        if (status >= 400 && status < 500) {
            return new WhatsAppApiException.ClientException(detail, status);
        }
        return new WhatsAppApiException(detail, status);
    }

    private WhatsAppApiException mapTransportException(WebClientRequestException ex) {
        Throwable cause = ex.getMostSpecificCause();
        if (cause instanceof ReadTimeoutException || cause instanceof WriteTimeoutException) {
            return WhatsAppApiException.timeout(properties.getSendTimeout());
        }
        return new WhatsAppApiException("WhatsApp API unreachable: " + cause.getMessage(), ex);
    }

    private String mask(String phone) {
        if (phone == null || phone.length() <= 4) return "****";
        return "*".repeat(phone.length() - 4) + phone.substring(phone.length() - 4);
    }
}
