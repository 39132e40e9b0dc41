package com.physio.search.store;

public record ExerciseMedia(String type, String url, boolean primary, String quality) {}
