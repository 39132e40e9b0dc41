package com.physio.search.store;

import com.physio.search.execution.SortSpec;
import com.physio.search.predicate.AiCategorizedEquals;
import com.physio.search.predicate.DurationBetween;
import com.physio.search.predicate.ExercisePredicate;
import com.physio.search.predicate.GoalsContain;
import com.physio.search.predicate.HasMedia;
import com.physio.search.predicate.ListOverlaps;
import com.physio.search.predicate.MinConfidence;
import com.physio.search.predicate.PredicateSet;
import com.physio.search.predicate.StatusEquals;
import com.physio.search.predicate.TextMatch;
import com.physio.search.predicate.ValueIn;
import com.physio.search.query.SortOrder;
import java.util.ArrayList;
import java.util.List;
import java.util.StringJoiner;

/**
 * Renders predicates and sort keys as PostgreSQL against the {@code exercises} table. Values are
 * always bound as parameters.
 */
final class SqlPredicateRenderer {
    static final String TEXT_SEARCH_CONFIG = "portuguese";
    private static final String REGEX_METACHARACTERS = "\\.[]{}()<>*+-=!?^$|";

    private SqlPredicateRenderer() {
    }

    static SqlFragment where(PredicateSet predicates) {
        if (predicates.isEmpty()) {
            return new SqlFragment("", List.of());
        }
        StringJoiner clauses = new StringJoiner(" AND ", "WHERE ", " ");
        List<Object> params = new ArrayList<>();
        for (ExercisePredicate predicate : predicates.predicates()) {
            clauses.add(render(predicate, params));
        }
        return new SqlFragment(clauses.toString(), params);
    }

    static String orderBy(SortSpec sort) {
        StringJoiner keys = new StringJoiner(", ", "ORDER BY ", " ");
        for (SortSpec.Key key : sort.keys()) {
            String direction = key.order() == SortOrder.ASC ? "ASC NULLS LAST" : "DESC NULLS LAST";
            keys.add(key.column().column() + " " + direction);
        }
        keys.add("id ASC");
        return keys.toString();
    }

    private static String render(ExercisePredicate predicate, List<Object> params) {
        if (predicate instanceof StatusEquals status) {
            params.add(status.status());
            return "status = ?";
        }
        if (predicate instanceof AiCategorizedEquals categorized) {
            params.add(categorized.aiCategorized());
            return "ai_categorized = ?";
        }
        if (predicate instanceof MinConfidence confidence) {
            params.add(confidence.threshold());
            return "ai_confidence >= ?";
        }
        if (predicate instanceof ValueIn valueIn) {
            params.addAll(valueIn.values());
            return valueIn.facet().column() + " IN (" + placeholders(valueIn.values().size()) + ")";
        }
        if (predicate instanceof DurationBetween duration) {
            List<String> bounds = new ArrayList<>(2);
            if (duration.min() != null) {
                params.add(duration.min());
                bounds.add("duration >= ?");
            }
            if (duration.max() != null) {
                params.add(duration.max());
                bounds.add("duration <= ?");
            }
            return bounds.isEmpty() ? "TRUE" : "(" + String.join(" AND ", bounds) + ")";
        }
        if (predicate instanceof ListOverlaps overlaps) {
            params.addAll(overlaps.values());
            return overlaps.facet().column() + " && ARRAY[" + placeholders(overlaps.values().size()) + "]::text[]";
        }
        if (predicate instanceof GoalsContain goals) {
            List<String> escaped = new ArrayList<>(goals.goals().size());
            for (String goal : goals.goals()) {
                escaped.add(escapeRegex(goal));
            }
            params.add(String.join(GoalsContain.ALTERNATION_DELIMITER, escaped));
            return "therapeutic_goals ~* ?";
        }
        if (predicate instanceof HasMedia) {
            return "(video_url IS NOT NULL OR thumbnail_url IS NOT NULL)";
        }
        if (predicate instanceof TextMatch text) {
            return text.fuzzy() ? renderFuzzy(text, params) : renderFullText(text, params);
        }
        throw new IllegalArgumentException("unsupported predicate: " + predicate.getClass().getName());
    }

    private static String renderFuzzy(TextMatch text, List<Object> params) {
        StringJoiner alternatives = new StringJoiner(" OR ", "(", ")");
        for (String variant : text.variants()) {
            String pattern = "%" + escapeLike(variant) + "%";
            for (String column : List.of("name", "description", "category", "therapeutic_goals")) {
                params.add(pattern);
                alternatives.add(column + " ILIKE ?");
            }
        }
        return alternatives.toString();
    }

    private static String renderFullText(TextMatch text, List<Object> params) {
        params.add(text.query());
        params.add(text.query());
        return "(to_tsvector('" + TEXT_SEARCH_CONFIG + "', COALESCE(name, '')) @@ plainto_tsquery('" + TEXT_SEARCH_CONFIG + "', ?)"
            + " OR to_tsvector('" + TEXT_SEARCH_CONFIG + "', COALESCE(description, '')) @@ plainto_tsquery('" + TEXT_SEARCH_CONFIG + "', ?))";
    }

    static String escapeLike(String value) {
        return value.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
    }

    static String escapeRegex(String value) {
        StringBuilder builder = new StringBuilder(value.length());
        for (char c : value.toCharArray()) {
            if (REGEX_METACHARACTERS.indexOf(c) >= 0) {
                builder.append('\\');
            }
            builder.append(c);
        }
        return builder.toString();
    }

    private static String placeholders(int count) {
        StringJoiner joiner = new StringJoiner(", ");
        for (int i = 0; i < count; i++) {
            joiner.add("?");
        }
        return joiner.toString();
    }
}
