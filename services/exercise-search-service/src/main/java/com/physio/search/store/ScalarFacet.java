package com.physio.search.store;

/**
 * Single-valued exercise columns that can be filtered by membership and grouped directly.
 */
public enum ScalarFacet {
    CATEGORY("category"),
    DIFFICULTY("difficulty");

    private final String column;

    ScalarFacet(String column) {
        this.column = column;
    }

    public String column() {
        return column;
    }

    public String valueOf(ExerciseRecord record) {
        return this == CATEGORY ? record.category() : record.difficulty();
    }
}
