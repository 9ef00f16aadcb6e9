package com.copas.services.ordercrm.service;

import com.copas.services.ordercrm.config.WhatsAppProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Turns a stored contact number into the digits-only international form the
 * WhatsApp Cloud API expects.
 *
 *   "+57 300 123 4567" → "573001234567"
 *   "300-123-4567"     → "573001234567"  (10-digit mobile starting with 3)
 *   "12345"            → empty           (too short to be a real number)
 */
@Component
@RequiredArgsConstructor
public class PhoneNumberNormalizer {

    private static final int LOCAL_MOBILE_LENGTH = 10;

    private final WhatsAppProperties whatsAppProperties;

    public Optional<String> normalize(String raw) {
        if (raw == null) return Optional.empty();

        String digits = raw.replaceAll("\\D", "");
        if (digits.length() < LOCAL_MOBILE_LENGTH) {
            return Optional.empty();
        }
        if (digits.length() == LOCAL_MOBILE_LENGTH && digits.startsWith("3")) {
            return Optional.of(whatsAppProperties.getDefaultCountryCode() + digits);
        }
        return Optional.of(digits);
    }
}
