package com.marketplace.realtime.model;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

@Converter(autoApply = true)
public class RequestStatusConverter implements AttributeConverter<RequestStatus, String> {

    @Override
    public String convertToDatabaseColumn(RequestStatus status) {
        return status == null ? null : status.wireValue();
    }

    @Override
    public RequestStatus convertToEntityAttribute(String value) {
        return RequestStatus.fromWire(value);
    }
}
