package com.copas.services.ordercrm.config;

import com.copas.services.ordercrm.constants.OrderCrmConstants;
import com.copas.services.ordercrm.dto.response.ApiResponse;
import com.copas.services.ordercrm.exception.WebhookAuthenticationException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;
import org.springframework.web.util.UrlPathHelper;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * Shared-secret gate for the order intake webhook.
 *
 * Runs before Spring MVC reads or validates the body, so a request with a
 * missing or wrong token never reaches payload validation or the database.
 *
 * Guarded paths:
 *   /api/v1/webhooks/**  (current)
 *   /webhook/**          (legacy path still configured in the Make scenario)
 *
 * Everything else (management API, health, docs) passes through untouched.
 */
@Component
@Order(1)
@RequiredArgsConstructor
@Slf4j
public class WebhookTokenFilter extends OncePerRequestFilter {

    private static final String WEBHOOK_PATH = OrderCrmConstants.API_V1 + "/webhooks/";
    private static final String LEGACY_WEBHOOK_PATH = "/webhook/";

    // Decoded, with ";" parameters and duplicate slashes removed: the path MVC routes on
    private static final UrlPathHelper URL_PATH_HELPER = new UrlPathHelper();

    private final WebhookProperties webhookProperties;
    private final ObjectMapper objectMapper;

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        return !isWebhookPath(URL_PATH_HELPER.getPathWithinApplication(request));
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain) throws ServletException, IOException {
        try {
            verifyToken(request.getHeader(webhookProperties.getTokenHeader()));
        } catch (WebhookAuthenticationException ex) {
            log.warn("Rejected webhook call: path={}, ip={}, reason={}",
                    request.getRequestURI(), request.getRemoteAddr(), ex.getMessage());
            writeUnauthorized(response, ex);
            return;
        }

        filterChain.doFilter(request, response);
    }

    void verifyToken(String received) {
        if (received == null || received.isBlank()) {
            throw WebhookAuthenticationException.missingToken(webhookProperties.getTokenHeader());
        }
        if (!constantTimeEquals(received, webhookProperties.getSecretToken())) {
            throw WebhookAuthenticationException.invalidToken();
        }
    }

    private void writeUnauthorized(HttpServletResponse response,
                                   WebhookAuthenticationException ex) throws IOException {
        response.setStatus(HttpStatus.UNAUTHORIZED.value());
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.setCharacterEncoding(StandardCharsets.UTF_8.name());
        objectMapper.writeValue(response.getWriter(),
                ApiResponse.error(ex.getMessage(), ex.getErrorCode()));
    }

    private boolean isWebhookPath(String path) {
        return path != null && (path.startsWith(WEBHOOK_PATH) || path.startsWith(LEGACY_WEBHOOK_PATH));
    }

    /** Constant-time comparison prevents timing attacks */
    private boolean constantTimeEquals(String a, String b) {
        if (b == null || a.length() != b.length()) return false;
        int diff = 0;
        for (int i = 0; i < a.length(); i++) diff |= a.charAt(i) ^ b.charAt(i);
        return diff == 0;
    }
}
