package com.physio.search.execution;

public enum SortColumn {
    NAME("name"),
    CATEGORY("category"),
    DIFFICULTY("difficulty"),
    CREATED_AT("created_at"),
    AI_CONFIDENCE("ai_confidence");

    private final String column;

    SortColumn(String column) {
        this.column = column;
    }

    public String column() {
        return column;
    }
}
