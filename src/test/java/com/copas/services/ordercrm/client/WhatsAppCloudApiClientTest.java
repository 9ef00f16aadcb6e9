package com.copas.services.ordercrm.client;

import com.copas.services.ordercrm.config.WebClientConfig;
import com.copas.services.ordercrm.config.WhatsAppProperties;
import com.copas.services.ordercrm.exception.WhatsAppApiException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.tomakehurst.wiremock.junit5.WireMockExtension;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.RegisterExtension;

import java.time.Duration;
import java.util.List;

import static com.github.tomakehurst.wiremock.client.WireMock.aResponse;
import static com.github.tomakehurst.wiremock.client.WireMock.equalTo;
import static com.github.tomakehurst.wiremock.client.WireMock.equalToJson;
import static com.github.tomakehurst.wiremock.client.WireMock.okJson;
import static com.github.tomakehurst.wiremock.client.WireMock.post;
import static com.github.tomakehurst.wiremock.client.WireMock.postRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.urlEqualTo;
import static com.github.tomakehurst.wiremock.core.WireMockConfiguration.wireMockConfig;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * HTTP contract with the Graph API messages endpoint, against WireMock.
 * The client is wired by hand, so no resilience aspects apply here.
 */
class WhatsAppCloudApiClientTest {

    @RegisterExtension
    static WireMockExtension graphApi = WireMockExtension.newInstance()
            .options(wireMockConfig().dynamicPort())
            .build();

    private static final String MESSAGES_PATH = "/v18.0/109876543210987/messages";

    private WhatsAppCloudApiClient client;

    @BeforeEach
    void setUp() {
        WhatsAppProperties properties = new WhatsAppProperties();
        properties.setGraphApiBaseUrl(graphApi.baseUrl());
        properties.setPhoneNumberId("109876543210987");
        properties.setAccessToken("test-access-token");
        properties.setSendTimeout(Duration.ofMillis(500));

        client = new WhatsAppCloudApiClient(
                WebClientConfig.buildWhatsAppWebClient(properties), properties, new ObjectMapper());
    }

    @Test
    @DisplayName("Sends the order_confirmation template and returns the message id")
    void shouldSendTemplate() {
        graphApi.stubFor(post(urlEqualTo(MESSAGES_PATH))
                .willReturn(okJson("""
                        {"messaging_product":"whatsapp",
                         "contacts":[{"input":"573001234567","wa_id":"573001234567"}],
                         "messages":[{"id":"wamid.HBgM123"}]}
                        """)));

        String messageId = client.sendTemplateMessage("573001234567", List.of("Ana", "#1001", "COP 150000.00"));

        assertThat(messageId).isEqualTo("wamid.HBgM123");
        graphApi.verify(postRequestedFor(urlEqualTo(MESSAGES_PATH))
                .withHeader("Authorization", equalTo("Bearer test-access-token"))
                .withRequestBody(equalToJson("""
                        {"messaging_product":"whatsapp",
                         "to":"573001234567",
                         "type":"template",
                         "template":{
                           "name":"order_confirmation",
                           "language":{"code":"es"},
                           "components":[{"type":"body","parameters":[
                             {"type":"text","text":"Ana"},
                             {"type":"text","text":"#1001"},
                             {"type":"text","text":"COP 150000.00"}]}]}}
                        """)));
    }

    @Test
    @DisplayName("4xx → ClientException carrying the provider message")
    void shouldMapClientError() {
        graphApi.stubFor(post(urlEqualTo(MESSAGES_PATH))
                .willReturn(aResponse()
                        .withStatus(400)
                        .withHeader("Content-Type", "application/json")
                        .withBody("{\"error\":{\"message\":\"(#132001) Template name does not exist\",\"code\":132001}}")));

        assertThatThrownBy(() -> client.sendTemplateMessage("573001234567", List.of("Ana", "#1001", "COP 1")))
                .isInstanceOf(WhatsAppApiException.ClientException.class)
                .hasMessage("HTTP 400: (#132001) Template name does not exist")
                .extracting("httpStatus").isEqualTo(400);
    }

    @Test
    @DisplayName("5xx with a non-JSON body → server error with raw body")
    void shouldMapServerError() {
        graphApi.stubFor(post(urlEqualTo(MESSAGES_PATH))
                .willReturn(aResponse().withStatus(503).withBody("upstream unavailable")));

        assertThatThrownBy(() -> client.sendTemplateMessage("573001234567", List.of("Ana", "#1001", "COP 1")))
                .isInstanceOf(WhatsAppApiException.class)
                .isNotInstanceOf(WhatsAppApiException.ClientException.class)
                .hasMessage("HTTP 503: upstream unavailable");
    }

    @Test
    @DisplayName("200 without a message id is a malformed response")
    void shouldRejectMissingMessageId() {
        graphApi.stubFor(post(urlEqualTo(MESSAGES_PATH))
                .willReturn(okJson("{\"messaging_product\":\"whatsapp\",\"messages\":[]}")));

        assertThatThrownBy(() -> client.sendTemplateMessage("573001234567", List.of("Ana", "#1001", "COP 1")))
                .isInstanceOf(WhatsAppApiException.class)
                .hasMessageContaining("no message id");
    }

    @Test
    @DisplayName("Slow provider → timeout failure")
    void shouldTimeOut() {
        graphApi.stubFor(post(urlEqualTo(MESSAGES_PATH))
                .willReturn(okJson("{\"messages\":[{\"id\":\"wamid.LATE\"}]}").withFixedDelay(3000)));

        assertThatThrownBy(() -> client.sendTemplateMessage("573001234567", List.of("Ana", "#1001", "COP 1")))
                .isInstanceOf(WhatsAppApiException.class)
                .hasMessageContaining("did not answer within 500ms")
                .extracting("httpStatus").isEqualTo(504);
    }
}
