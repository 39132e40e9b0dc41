package com.physio.search.ranking;

import com.physio.search.query.QueryNormalizer;
import com.physio.search.store.ExerciseRecord;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import org.springframework.stereotype.Component;

/**
 * Re-orders one page of candidates for a free-text query.
 *
 * <p>Only the page handed in is ranked, never the whole match population. Equal scores keep the
 * incoming order.
 */
@Component
public class RelevanceRanker {
    private static final double MILLIS_PER_DAY = Duration.ofDays(1).toMillis();

    private final RankingWeightsProperties weights;
    private final QueryNormalizer queryNormalizer;
    private final Clock clock;

    public RelevanceRanker(RankingWeightsProperties weights, QueryNormalizer queryNormalizer, Clock searchClock) {
        this.weights = weights;
        this.queryNormalizer = queryNormalizer;
        this.clock = searchClock;
    }

    /**
     * @param withSynonyms when true, synonyms of the query words score like the words themselves
     */
    public List<ScoredExercise> rank(List<ExerciseRecord> candidates, String query, boolean withSynonyms) {
        List<ScoredExercise> scored = new ArrayList<>(candidates.size());
        if (query == null || query.isBlank()) {
            for (ExerciseRecord candidate : candidates) {
                scored.add(new ScoredExercise(candidate, 0.0));
            }
            return scored;
        }
        String lowerQuery = query.trim().toLowerCase(Locale.ROOT);
        List<String> tokens = tokens(lowerQuery, withSynonyms ? queryNormalizer.synonyms(query) : List.of());
        long now = clock.millis();
        for (ExerciseRecord candidate : candidates) {
            scored.add(new ScoredExercise(candidate, score(candidate, lowerQuery, tokens, now)));
        }
        scored.sort(Comparator.comparingDouble(ScoredExercise::score).reversed());
        return scored;
    }

    double score(ExerciseRecord exercise, String lowerQuery, List<String> tokens, long nowMs) {
        double score = 0.0;

        String searchText = (nullToEmpty(exercise.name()) + " "
            + nullToEmpty(exercise.description()) + " "
            + nullToEmpty(exercise.category()) + " "
            + nullToEmpty(exercise.therapeuticGoals())).toLowerCase(Locale.ROOT);
        if (searchText.contains(lowerQuery)) {
            score += weights.getExactPhrase();
        }

        String name = lower(exercise.name());
        String category = lower(exercise.category());
        String description = lower(exercise.description());
        String goals = lower(exercise.therapeuticGoals());
        for (String token : tokens) {
            if (name != null && name.contains(token)) {
                score += weights.getNameToken();
            }
            if (category != null && category.contains(token)) {
                score += weights.getCategoryToken();
            }
            if (description != null && description.contains(token)) {
                score += weights.getDescriptionToken();
            }
            if (goals != null && goals.contains(token)) {
                score += weights.getGoalsToken();
            }
        }

        if (exercise.aiConfidence() != null) {
            score += exercise.aiConfidence() * weights.getConfidenceFactor();
        }

        if (exercise.createdAt() != null) {
            double daysSinceCreation = (nowMs - exercise.createdAt().toEpochMilli()) / MILLIS_PER_DAY;
            if (daysSinceCreation < weights.getRecencyWindowDays()) {
                score += Math.max(0.0, weights.getRecencyMaxBonus() - daysSinceCreation * weights.getRecencyDecayPerDay());
            }
        }
        return score;
    }

    /**
     * Query words plus synonyms. A synonym overlapping a query word is skipped so one field match is
     * never counted twice.
     */
    static List<String> tokens(String lowerQuery, List<String> synonyms) {
        Set<String> words = new LinkedHashSet<>();
        for (String part : lowerQuery.trim().split("\\s+")) {
            if (part.length() > 1) {
                words.add(part);
            }
        }
        List<String> tokens = new ArrayList<>(words);
        for (String synonym : synonyms) {
            String candidate = synonym.trim().toLowerCase(Locale.ROOT);
            if (candidate.length() > 1 && !overlapsAny(candidate, words) && !tokens.contains(candidate)) {
                tokens.add(candidate);
            }
        }
        return tokens;
    }

    private static boolean overlapsAny(String candidate, Set<String> words) {
        for (String word : words) {
            if (word.contains(candidate) || candidate.contains(word)) {
                return true;
            }
        }
        return false;
    }

    private static String lower(String value) {
        return value == null ? null : value.toLowerCase(Locale.ROOT);
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
