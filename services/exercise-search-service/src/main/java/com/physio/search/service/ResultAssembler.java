package com.physio.search.service;

import com.physio.search.aggregation.FacetCounts;
import com.physio.search.api.dto.ExerciseHit;
import com.physio.search.api.dto.SearchResponse;
import com.physio.search.query.SearchCriteria;
import com.physio.search.ranking.ScoredExercise;
import com.physio.search.store.ExerciseMedia;
import com.physio.search.store.ExerciseRecord;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.springframework.stereotype.Component;

@Component
public class ResultAssembler {
    static final String ALGORITHM_FUZZY_FULL_TEXT = "fuzzy_full_text";
    static final String ALGORITHM_EXACT_FULL_TEXT = "exact_full_text";
    static final String ALGORITHM_FACETED_FILTER = "faceted_filter";
    static final String ALGORITHM_SIMPLE_FILTER = "simple_filter";

    public SearchResponse assemble(
        SearchCriteria criteria,
        List<ScoredExercise> exercises,
        boolean ranked,
        FacetCounts facets,
        long total,
        List<String> normalizedQueries,
        double queryTimeMs,
        int totalIndexed
    ) {
        List<ExerciseHit> hits = new ArrayList<>(exercises.size());
        for (ScoredExercise scored : exercises) {
            hits.add(toHit(scored.exercise(), ranked ? scored.score() : null, criteria.includeMedia()));
        }

        SearchResponse response = new SearchResponse();
        response.setExercises(Collections.unmodifiableList(hits));
        response.setAggregations(toAggregations(facets));
        response.setPagination(new SearchResponse.Pagination(
            total,
            criteria.limit(),
            criteria.offset(),
            (long) criteria.offset() + criteria.limit() < total
        ));

        SearchResponse.SearchMetadata metadata = new SearchResponse.SearchMetadata();
        metadata.setQueryTime(queryTimeMs);
        metadata.setCacheHit(false);
        metadata.setAlgorithmUsed(determineAlgorithm(criteria));
        metadata.setTotalIndexed(totalIndexed);
        if (criteria.includeMetadata()) {
            metadata.setNormalizedQueries(normalizedQueries == null ? List.of() : List.copyOf(normalizedQueries));
        }
        response.setSearchMetadata(metadata);
        return response;
    }

    public static String determineAlgorithm(SearchCriteria criteria) {
        if (criteria.hasQuery() && criteria.fuzzyMatch()) {
            return ALGORITHM_FUZZY_FULL_TEXT;
        }
        if (criteria.hasQuery()) {
            return ALGORITHM_EXACT_FULL_TEXT;
        }
        if (criteria.hasFacetFilters()) {
            return ALGORITHM_FACETED_FILTER;
        }
        return ALGORITHM_SIMPLE_FILTER;
    }

    private ExerciseHit toHit(ExerciseRecord record, Double relevanceScore, boolean includeMedia) {
        ExerciseHit hit = new ExerciseHit();
        hit.setId(record.id());
        hit.setName(record.name());
        hit.setDescription(record.description());
        hit.setCategory(record.category());
        hit.setSubcategory(record.subcategory());
        hit.setBodyParts(record.bodyParts());
        hit.setEquipment(record.equipment());
        hit.setDifficulty(record.difficulty());
        hit.setDuration(record.duration());
        hit.setTherapeuticGoals(record.therapeuticGoals());
        hit.setAiCategorized(record.aiCategorized());
        hit.setAiConfidence(record.aiConfidence());
        hit.setStatus(record.status());
        hit.setVideoUrl(record.videoUrl());
        hit.setThumbnailUrl(record.thumbnailUrl());
        hit.setCreatedAt(record.createdAt());
        if (includeMedia) {
            List<ExerciseHit.Media> media = new ArrayList<>(record.media().size());
            for (ExerciseMedia attachment : record.media()) {
                ExerciseHit.Media item = new ExerciseHit.Media();
                item.setType(attachment.type());
                item.setUrl(attachment.url());
                item.setPrimary(attachment.primary());
                item.setQuality(attachment.quality());
                media.add(item);
            }
            hit.setMedia(Collections.unmodifiableList(media));
        }
        hit.setRelevanceScore(relevanceScore);
        return hit;
    }

    private SearchResponse.Aggregations toAggregations(FacetCounts facets) {
        SearchResponse.Aggregations aggregations = new SearchResponse.Aggregations();
        aggregations.setCategories(facets.categories());
        aggregations.setDifficulties(facets.difficulties());
        aggregations.setBodyParts(facets.bodyParts());
        aggregations.setEquipment(facets.equipment());
        aggregations.setTherapeuticGoals(facets.therapeuticGoals());
        return aggregations;
    }
}
