package com.physio.search.query;

import java.util.List;

/**
 * Validated, immutable form of a search request. Built once per call by
 * {@link com.physio.search.service.SearchRequestValidator}.
 *
 * <p>Collection fields are never null; absent filters are empty lists. Nullable wrapper fields
 * mean "not specified".
 */
public record SearchCriteria(
    String query,
    List<String> categories,
    List<String> bodyParts,
    List<String> equipment,
    List<String> difficulties,
    List<String> therapeuticGoals,
    Integer durationMin,
    Integer durationMax,
    Boolean aiCategorized,
    Double minConfidence,
    boolean hasMedia,
    boolean approvedOnly,
    SortField sortBy,
    SortOrder sortOrder,
    int limit,
    int offset,
    boolean includeMetadata,
    boolean includeMedia,
    boolean fuzzyMatch,
    String cacheKey
) {
    public SearchCriteria {
        categories = copy(categories);
        bodyParts = copy(bodyParts);
        equipment = copy(equipment);
        difficulties = copy(difficulties);
        therapeuticGoals = copy(therapeuticGoals);
        sortBy = sortBy == null ? SortField.RELEVANCE : sortBy;
        sortOrder = sortOrder == null ? SortOrder.DESC : sortOrder;
    }

    public boolean hasQuery() {
        return query != null && !query.isBlank();
    }

    public boolean hasFacetFilters() {
        return !categories.isEmpty() || !bodyParts.isEmpty() || !equipment.isEmpty();
    }

    public boolean hasDurationRange() {
        return durationMin != null || durationMax != null;
    }

    private static List<String> copy(List<String> values) {
        return values == null ? List.of() : List.copyOf(values);
    }
}
