package com.marketplace.realtime.model;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

@Converter(autoApply = true)
public class NotificationTypeConverter implements AttributeConverter<NotificationType, String> {

    @Override
    public String convertToDatabaseColumn(NotificationType type) {
        return type == null ? null : type.wireValue();
    }

    @Override
    public NotificationType convertToEntityAttribute(String value) {
        return NotificationType.fromWire(value);
    }
}
