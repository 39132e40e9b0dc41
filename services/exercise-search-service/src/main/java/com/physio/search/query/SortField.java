package com.physio.search.query;

import java.util.Locale;
import java.util.Optional;

public enum SortField {
    RELEVANCE("relevance"),
    NAME("name"),
    CATEGORY("category"),
    DIFFICULTY("difficulty"),
    CREATED_AT("created_at"),
    AI_CONFIDENCE("ai_confidence");

    private final String wireValue;

    SortField(String wireValue) {
        this.wireValue = wireValue;
    }

    public String wireValue() {
        return wireValue;
    }

    public static Optional<SortField> fromWire(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (SortField field : values()) {
            if (field.wireValue.equals(normalized)) {
                return Optional.of(field);
            }
        }
        return Optional.empty();
    }
}
