package com.physio.search.predicate;

import com.physio.search.store.ExerciseRecord;

/**
 * One store-agnostic filter condition. Stores translate predicates into their own query
 * language; {@link #matches(ExerciseRecord)} is the reference semantics they must agree with.
 */
public interface ExercisePredicate {

    FilterKind kind();

    boolean matches(ExerciseRecord record);
}
