package com.costwatch.anomaly.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum AnomalyStatus {
    NEW,
    ACKNOWLEDGED,
    RESOLVED,
    FALSE_POSITIVE;

    @JsonValue
    public String getId() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static AnomalyStatus fromId(String id) {
        return valueOf(id.toUpperCase(Locale.ROOT));
    }
}
