package com.physio.search.aggregation;

import com.physio.search.predicate.PredicateSet;
import com.physio.search.store.ExerciseStore;
import com.physio.search.store.ListFacet;
import com.physio.search.store.ScalarFacet;
import java.util.Map;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Computes facet counts over everything the search matches except its own facet filters, so a
 * selected category does not hide the counts of its siblings.
 */
@Component
public class AggregationEngine {
    public static final int DEFAULT_LIST_FACET_LIMIT = 20;

    private final ExerciseStore exerciseStore;
    private final int listFacetLimit;

    public AggregationEngine(
        ExerciseStore exerciseStore,
        @Value("${search.aggregation.list-facet-limit:" + DEFAULT_LIST_FACET_LIMIT + "}") int listFacetLimit
    ) {
        this.exerciseStore = exerciseStore;
        this.listFacetLimit = Math.max(1, listFacetLimit);
    }

    public FacetCounts aggregate(PredicateSet predicates) {
        PredicateSet base = predicates.withoutFacetFilters();
        return new FacetCounts(
            exerciseStore.countBy(base, ScalarFacet.CATEGORY),
            exerciseStore.countBy(base, ScalarFacet.DIFFICULTY),
            exerciseStore.countListValues(base, ListFacet.BODY_PARTS, listFacetLimit),
            exerciseStore.countListValues(base, ListFacet.EQUIPMENT, listFacetLimit),
            // goal text is free-form; no bucketing exists for it yet
            Map.of()
        );
    }
}
