package com.physio.search.predicate;

import com.physio.search.store.ExerciseRecord;

public record HasMedia() implements ExercisePredicate {

    @Override
    public FilterKind kind() {
        return FilterKind.MEDIA;
    }

    @Override
    public boolean matches(ExerciseRecord record) {
        return record.videoUrl() != null || record.thumbnailUrl() != null;
    }
}
