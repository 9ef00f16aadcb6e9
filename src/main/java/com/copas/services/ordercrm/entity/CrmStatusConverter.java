package com.copas.services.ordercrm.entity;

import com.copas.services.ordercrm.constants.CrmStatus;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

/**
 * Stores {@link CrmStatus} by its lowercase value ("nuevo", "en_proceso", ...),
 * matching the CHECK constraint on orders.status.
 */
@Converter(autoApply = true)
public class CrmStatusConverter implements AttributeConverter<CrmStatus, String> {

    @Override
    public String convertToDatabaseColumn(CrmStatus status) {
        return status == null ? null : status.getValue();
    }

    @Override
    public CrmStatus convertToEntityAttribute(String value) {
        return value == null ? null : CrmStatus.fromValue(value);
    }
}
