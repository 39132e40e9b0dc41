package com.physio.search.store;

import java.time.Instant;
import java.util.List;

public record ExerciseRecord(
    String id,
    String name,
    String description,
    String category,
    String subcategory,
    List<String> bodyParts,
    List<String> equipment,
    String difficulty,
    Integer duration,
    String therapeuticGoals,
    boolean aiCategorized,
    Double aiConfidence,
    String status,
    String videoUrl,
    String thumbnailUrl,
    List<ExerciseMedia> media,
    Instant createdAt
) {
    public ExerciseRecord {
        bodyParts = bodyParts == null ? List.of() : List.copyOf(bodyParts);
        equipment = equipment == null ? List.of() : List.copyOf(equipment);
        media = media == null ? List.of() : List.copyOf(media);
    }

    public ExerciseRecord withMedia(List<ExerciseMedia> attachments) {
        return new ExerciseRecord(
            id,
            name,
            description,
            category,
            subcategory,
            bodyParts,
            equipment,
            difficulty,
            duration,
            therapeuticGoals,
            aiCategorized,
            aiConfidence,
            status,
            videoUrl,
            thumbnailUrl,
            attachments,
            createdAt
        );
    }
}
