package com.physio.search.service;

public record FieldViolation(String field, String message) {}
