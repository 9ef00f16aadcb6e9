package com.copas.services.ordercrm.dto.response;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * Response of POST /{phone-number-id}/messages.
 *
 * Success:
 *   { "messaging_product": "whatsapp",
 *     "contacts": [ { "input": "573001234567", "wa_id": "573001234567" } ],
 *     "messages": [ { "id": "wamid.HBgM..." } ] }
 *
 * Error (normally with a 4xx/5xx status, occasionally with 200):
 *   { "error": { "message": "...", "type": "OAuthException", "code": 131030 } }
 *
 * Unknown fields are ignored here: this is the provider's contract, not ours.
 */
@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class WhatsAppMessageResponse {

    @JsonProperty("messaging_product")
    private String messagingProduct;

    @JsonProperty("messages")
    private List<Map<String, Object>> messages;

    @JsonProperty("error")
    private Map<String, Object> error;

    /**
     * Id of the first accepted message, or null when absent.
     */
    public String getFirstMessageId() {
        if (messages == null || messages.isEmpty()) return null;
        Object id = messages.get(0).get("id");
        if (id == null || String.valueOf(id).isBlank()) return null;
        return String.valueOf(id);
    }

    /**
     * Get error message if present, or null.
     */
    public String getErrorMessage() {
        if (error == null) return null;
        Object msg = error.get("message");
        return msg != null ? String.valueOf(msg) : "Unknown WhatsApp API error";
    }
}
