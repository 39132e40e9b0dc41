package com.physio.search.predicate;

import com.physio.search.store.ExerciseRecord;
import java.util.List;
import java.util.Locale;

/**
 * Therapeutic goals text contains any of the given goals, ignoring case. Stores receive the
 * goals as a single {@code |}-joined alternation via {@link #alternation()}.
 */
public record GoalsContain(List<String> goals) implements ExercisePredicate {
    public static final String ALTERNATION_DELIMITER = "|";

    public GoalsContain {
        goals = List.copyOf(goals);
    }

    public String alternation() {
        return String.join(ALTERNATION_DELIMITER, goals);
    }

    @Override
    public FilterKind kind() {
        return FilterKind.THERAPEUTIC_GOALS;
    }

    @Override
    public boolean matches(ExerciseRecord record) {
        if (record.therapeuticGoals() == null) {
            return false;
        }
        String text = record.therapeuticGoals().toLowerCase(Locale.ROOT);
        for (String goal : goals) {
            if (text.contains(goal.toLowerCase(Locale.ROOT))) {
                return true;
            }
        }
        return false;
    }
}
