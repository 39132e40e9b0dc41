package com.physio.search.ranking;

import com.physio.search.store.ExerciseRecord;

public record ScoredExercise(ExerciseRecord exercise, double score) {}
