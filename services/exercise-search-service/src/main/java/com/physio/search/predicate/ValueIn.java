package com.physio.search.predicate;

import com.physio.search.store.ExerciseRecord;
import com.physio.search.store.ScalarFacet;
import java.util.List;

/**
 * Scalar column equals any of the given values.
 */
public record ValueIn(ScalarFacet facet, List<String> values) implements ExercisePredicate {
    public ValueIn {
        values = List.copyOf(values);
    }

    @Override
    public FilterKind kind() {
        return facet == ScalarFacet.CATEGORY ? FilterKind.CATEGORY : FilterKind.DIFFICULTY;
    }

    @Override
    public boolean matches(ExerciseRecord record) {
        String value = facet.valueOf(record);
        return value != null && values.contains(value);
    }
}
