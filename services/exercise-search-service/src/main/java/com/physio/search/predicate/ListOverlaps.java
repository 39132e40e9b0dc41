package com.physio.search.predicate;

import com.physio.search.store.ExerciseRecord;
import com.physio.search.store.ListFacet;
import java.util.List;

/**
 * Array column shares at least one value with the given list.
 */
public record ListOverlaps(ListFacet facet, List<String> values) implements ExercisePredicate {
    public ListOverlaps {
        values = List.copyOf(values);
    }

    @Override
    public FilterKind kind() {
        return facet == ListFacet.BODY_PARTS ? FilterKind.BODY_PARTS : FilterKind.EQUIPMENT;
    }

    @Override
    public boolean matches(ExerciseRecord record) {
        for (String value : facet.valuesOf(record)) {
            if (values.contains(value)) {
                return true;
            }
        }
        return false;
    }
}
