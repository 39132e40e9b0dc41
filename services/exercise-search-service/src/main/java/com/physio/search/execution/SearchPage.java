package com.physio.search.execution;

import com.physio.search.store.ExerciseRecord;
import java.util.List;

public record SearchPage(List<ExerciseRecord> exercises, long total) {
    public SearchPage {
        exercises = List.copyOf(exercises);
    }
}
