package com.physio.search.store;

import java.util.List;

/**
 * Array-valued exercise columns. Grouping counts a record once per value it holds.
 */
public enum ListFacet {
    BODY_PARTS("body_parts"),
    EQUIPMENT("equipment");

    private final String column;

    ListFacet(String column) {
        this.column = column;
    }

    public String column() {
        return column;
    }

    public List<String> valuesOf(ExerciseRecord record) {
        return this == BODY_PARTS ? record.bodyParts() : record.equipment();
    }
}
