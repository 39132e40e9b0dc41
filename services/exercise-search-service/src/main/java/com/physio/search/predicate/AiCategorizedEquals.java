package com.physio.search.predicate;

import com.physio.search.store.ExerciseRecord;

public record AiCategorizedEquals(boolean aiCategorized) implements ExercisePredicate {

    @Override
    public FilterKind kind() {
        return FilterKind.AI_CATEGORIZED;
    }

    @Override
    public boolean matches(ExerciseRecord record) {
        return record.aiCategorized() == aiCategorized;
    }
}
