package com.copas.services.ordercrm.constants;

import java.util.Arrays;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Internal CRM lifecycle label of an order.
 *
 * Transitions are operator-driven: any status may move to any other,
 * including out of CANCELADO. The only enforced rule is membership in this set.
 */
public enum CrmStatus {
    NUEVO("nuevo"),
    EN_PROCESO("en_proceso"),
    ENVIADO("enviado"),
    COMPLETADO("completado"),
    CANCELADO("cancelado");

    private static final Map<String, CrmStatus> LOOKUP =
            Arrays.stream(values())
                    .collect(Collectors.toUnmodifiableMap(CrmStatus::getValue, Function.identity()));

    private final String value;

    CrmStatus(String value) {
        this.value = value;
    }

    /** Wire and database value. */
    public String getValue() {
        return value;
    }

    public static CrmStatus fromValue(String value) {
        CrmStatus status = value == null ? null : LOOKUP.get(value.trim().toLowerCase());
        if (status == null) {
            throw new IllegalArgumentException("Invalid CRM status: " + value);
        }
        return status;
    }

    public static String allowedValues() {
        return Arrays.stream(values())
                .map(CrmStatus::getValue)
                .collect(Collectors.joining(", "));
    }
}
