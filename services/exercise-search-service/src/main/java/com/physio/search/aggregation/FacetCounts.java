package com.physio.search.aggregation;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Facet buckets for one search. Therapeutic goals are never aggregated and always come back empty.
 */
public record FacetCounts(
    Map<String, Long> categories,
    Map<String, Long> difficulties,
    Map<String, Long> bodyParts,
    Map<String, Long> equipment,
    Map<String, Long> therapeuticGoals
) {
    public FacetCounts {
        categories = freeze(categories);
        difficulties = freeze(difficulties);
        bodyParts = freeze(bodyParts);
        equipment = freeze(equipment);
        therapeuticGoals = freeze(therapeuticGoals);
    }

    private static Map<String, Long> freeze(Map<String, Long> buckets) {
        return buckets == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(buckets));
    }
}
