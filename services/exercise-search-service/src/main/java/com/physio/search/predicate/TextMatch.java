package com.physio.search.predicate;

import com.physio.search.store.ExerciseRecord;
import java.util.List;
import java.util.Locale;

/**
 * Free-text condition.
 *
 * <p>Fuzzy: any variant is a case-insensitive substring of name, description, category or
 * therapeutic goals. Exact: the literal query is matched as full text against name or description
 * only, meaning every word of the query occurs in that field.
 */
public record TextMatch(String query, List<String> variants, boolean fuzzy) implements ExercisePredicate {
    public TextMatch {
        variants = List.copyOf(variants);
    }

    @Override
    public FilterKind kind() {
        return FilterKind.TEXT;
    }

    @Override
    public boolean matches(ExerciseRecord record) {
        if (fuzzy) {
            for (String variant : variants) {
                String needle = variant.toLowerCase(Locale.ROOT);
                if (containsIgnoreCase(record.name(), needle)
                    || containsIgnoreCase(record.description(), needle)
                    || containsIgnoreCase(record.category(), needle)
                    || containsIgnoreCase(record.therapeuticGoals(), needle)) {
                    return true;
                }
            }
            return false;
        }
        return containsAllWords(record.name()) || containsAllWords(record.description());
    }

    private boolean containsAllWords(String field) {
        if (field == null) {
            return false;
        }
        String[] words = query.toLowerCase(Locale.ROOT).trim().split("\\s+");
        for (String word : words) {
            if (!containsIgnoreCase(field, word)) {
                return false;
            }
        }
        return true;
    }

    private static boolean containsIgnoreCase(String field, String lowerNeedle) {
        return field != null && field.toLowerCase(Locale.ROOT).contains(lowerNeedle);
    }
}
