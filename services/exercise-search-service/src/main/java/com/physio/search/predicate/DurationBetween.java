package com.physio.search.predicate;

import com.physio.search.store.ExerciseRecord;

/**
 * Inclusive duration range; a null bound is open.
 */
public record DurationBetween(Integer min, Integer max) implements ExercisePredicate {

    @Override
    public FilterKind kind() {
        return FilterKind.DURATION;
    }

    @Override
    public boolean matches(ExerciseRecord record) {
        Integer duration = record.duration();
        if (duration == null) {
            return false;
        }
        if (min != null && duration < min) {
            return false;
        }
        return max == null || duration <= max;
    }
}
