package com.trackflow.model;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

@Converter(autoApply = true)
public class TrackStatusConverter implements AttributeConverter<TrackStatus, String> {

    @Override
    public String convertToDatabaseColumn(TrackStatus status) {
        return status == null ? null : status.value();
    }

    @Override
    public TrackStatus convertToEntityAttribute(String value) {
        return value == null ? null : TrackStatus.fromValue(value);
    }
}
