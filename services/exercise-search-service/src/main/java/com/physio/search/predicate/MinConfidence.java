package com.physio.search.predicate;

import com.physio.search.store.ExerciseRecord;

public record MinConfidence(double threshold) implements ExercisePredicate {

    @Override
    public FilterKind kind() {
        return FilterKind.CONFIDENCE;
    }

    @Override
    public boolean matches(ExerciseRecord record) {
        return record.aiConfidence() != null && record.aiConfidence() >= threshold;
    }
}
