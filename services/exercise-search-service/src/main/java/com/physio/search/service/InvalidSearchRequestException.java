package com.physio.search.service;

import java.util.List;

public class InvalidSearchRequestException extends RuntimeException {
    private final List<FieldViolation> violations;

    public InvalidSearchRequestException(String message) {
        this(message, List.of());
    }

    public InvalidSearchRequestException(String message, List<FieldViolation> violations) {
        super(message);
        this.violations = List.copyOf(violations);
    }

    public List<FieldViolation> getViolations() {
        return violations;
    }
}
