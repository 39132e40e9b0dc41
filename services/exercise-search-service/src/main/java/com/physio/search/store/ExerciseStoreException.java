package com.physio.search.store;

public class ExerciseStoreException extends RuntimeException {
    public ExerciseStoreException(String message) {
        super(message);
    }

    public ExerciseStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
