package com.physio.search.predicate;

import com.physio.search.store.ExerciseRecord;
import java.util.ArrayList;
import java.util.List;

/**
 * Conjunction of predicates. Immutable.
 */
public final class PredicateSet {
    private static final PredicateSet EMPTY = new PredicateSet(List.of());

    private final List<ExercisePredicate> predicates;

    private PredicateSet(List<ExercisePredicate> predicates) {
        this.predicates = List.copyOf(predicates);
    }

    public static PredicateSet of(List<ExercisePredicate> predicates) {
        return predicates == null || predicates.isEmpty() ? EMPTY : new PredicateSet(predicates);
    }

    public List<ExercisePredicate> predicates() {
        return predicates;
    }

    public boolean isEmpty() {
        return predicates.isEmpty();
    }

    boolean contains(FilterKind kind) {
        for (ExercisePredicate predicate : predicates) {
            if (predicate.kind() == kind) {
                return true;
            }
        }
        return false;
    }

    /**
     * Same conditions minus category, difficulty, body part, equipment and goal filters.
     */
    public PredicateSet withoutFacetFilters() {
        List<ExercisePredicate> kept = new ArrayList<>(predicates.size());
        for (ExercisePredicate predicate : predicates) {
            if (!predicate.kind().isFacet()) {
                kept.add(predicate);
            }
        }
        return of(kept);
    }

    public boolean matches(ExerciseRecord record) {
        for (ExercisePredicate predicate : predicates) {
            if (!predicate.matches(record)) {
                return false;
            }
        }
        return true;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof PredicateSet other)) {
            return false;
        }
        return predicates.equals(other.predicates);
    }

    @Override
    public int hashCode() {
        return predicates.hashCode();
    }

    @Override
    public String toString() {
        return "PredicateSet" + predicates;
    }
}
