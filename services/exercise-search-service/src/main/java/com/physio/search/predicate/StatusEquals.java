package com.physio.search.predicate;

import com.physio.search.store.ExerciseRecord;

public record StatusEquals(String status) implements ExercisePredicate {
    public static final String APPROVED = "approved";

    @Override
    public FilterKind kind() {
        return FilterKind.STATUS;
    }

    @Override
    public boolean matches(ExerciseRecord record) {
        return status.equals(record.status());
    }
}
