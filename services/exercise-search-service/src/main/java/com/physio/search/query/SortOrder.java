package com.physio.search.query;

import java.util.Locale;
import java.util.Optional;

public enum SortOrder {
    ASC,
    DESC;

    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<SortOrder> fromWire(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (SortOrder order : values()) {
            if (order.wireValue().equals(normalized)) {
                return Optional.of(order);
            }
        }
        return Optional.empty();
    }
}
