package com.physio.search.predicate;

public enum FilterKind {
    STATUS(false),
    AI_CATEGORIZED(false),
    CONFIDENCE(false),
    CATEGORY(true),
    DIFFICULTY(true),
    DURATION(false),
    BODY_PARTS(true),
    EQUIPMENT(true),
    THERAPEUTIC_GOALS(true),
    MEDIA(false),
    TEXT(false);

    private final boolean facet;

    FilterKind(boolean facet) {
        this.facet = facet;
    }

    /**
     * Facet filters are dropped when computing aggregations so every bucket stays selectable.
     */
    public boolean isFacet() {
        return facet;
    }
}
