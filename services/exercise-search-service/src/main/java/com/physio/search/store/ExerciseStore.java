package com.physio.search.store;

import com.physio.search.execution.SortSpec;
import com.physio.search.predicate.PredicateSet;
import java.util.List;
import java.util.Map;

/**
 * Read-only view of the exercise library.
 *
 * <p>Implementations throw {@link ExerciseStoreException} when the backing store cannot answer.
 * Retries, if any, belong to the implementation.
 */
public interface ExerciseStore {

    List<ExerciseRecord> find(PredicateSet predicates, SortSpec sort, int limit, int offset, boolean includeMedia);

    long count(PredicateSet predicates);

    /**
     * Counts matching records per non-null value of a scalar column.
     */
    Map<String, Long> countBy(PredicateSet predicates, ScalarFacet facet);

    /**
     * Counts matching records per value of an array column, most frequent first, at most {@code limit} values.
     */
    Map<String, Long> countListValues(PredicateSet predicates, ListFacet facet, int limit);
}
