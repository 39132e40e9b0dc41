package com.physio.search.service;

import com.physio.search.api.dto.SearchRequest;
import com.physio.search.query.SearchCriteria;
import com.physio.search.query.SortField;
import com.physio.search.query.SortOrder;
import java.util.ArrayList;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Checks a raw request and turns it into {@link SearchCriteria}. All violations are collected and
 * reported together; nothing downstream runs for an invalid request.
 */
@Component
public class SearchRequestValidator {
    static final int DEFAULT_LIMIT = 20;
    static final int MIN_LIMIT = 1;
    static final int MAX_LIMIT = 100;
    static final int DEFAULT_OFFSET = 0;
    static final double MIN_CONFIDENCE = 0.0;
    static final double MAX_CONFIDENCE = 100.0;
    static final int MAX_CACHE_KEY_LENGTH = 256;

    public SearchCriteria validate(SearchRequest request) {
        if (request == null) {
            throw new InvalidSearchRequestException("request body is required");
        }
        List<FieldViolation> violations = new ArrayList<>();

        int limit = request.getLimit() == null ? DEFAULT_LIMIT : request.getLimit();
        if (limit < MIN_LIMIT || limit > MAX_LIMIT) {
            violations.add(new FieldViolation("limit", "must be between " + MIN_LIMIT + " and " + MAX_LIMIT));
        }
        int offset = request.getOffset() == null ? DEFAULT_OFFSET : request.getOffset();
        if (offset < 0) {
            violations.add(new FieldViolation("offset", "must be greater than or equal to 0"));
        }

        Double minConfidence = request.getMinConfidence();
        if (minConfidence != null
            && (minConfidence.isNaN() || minConfidence < MIN_CONFIDENCE || minConfidence > MAX_CONFIDENCE)) {
            violations.add(new FieldViolation("minConfidence", "must be between 0 and 100"));
        }

        Integer durationMin = null;
        Integer durationMax = null;
        SearchRequest.DurationRange duration = request.getDuration();
        if (duration != null) {
            durationMin = duration.getMin();
            durationMax = duration.getMax();
            if (durationMin != null && durationMin < 0) {
                violations.add(new FieldViolation("duration.min", "must be greater than or equal to 0"));
            }
            if (durationMax != null && durationMax < 0) {
                violations.add(new FieldViolation("duration.max", "must be greater than or equal to 0"));
            }
            if (durationMin != null && durationMax != null && durationMin > durationMax) {
                violations.add(new FieldViolation("duration", "min must not be greater than max"));
            }
        }

        SortField sortBy = SortField.RELEVANCE;
        if (request.getSortBy() != null) {
            sortBy = SortField.fromWire(request.getSortBy()).orElse(null);
            if (sortBy == null) {
                violations.add(new FieldViolation(
                    "sortBy",
                    "must be one of relevance, name, category, difficulty, created_at, ai_confidence"
                ));
            }
        }
        SortOrder sortOrder = SortOrder.DESC;
        if (request.getSortOrder() != null) {
            sortOrder = SortOrder.fromWire(request.getSortOrder()).orElse(null);
            if (sortOrder == null) {
                violations.add(new FieldViolation("sortOrder", "must be one of asc, desc"));
            }
        }

        checkValues("categories", request.getCategories(), violations);
        checkValues("bodyParts", request.getBodyParts(), violations);
        checkValues("equipment", request.getEquipment(), violations);
        checkValues("difficulty", request.getDifficulty(), violations);
        checkValues("therapeuticGoals", request.getTherapeuticGoals(), violations);

        if (request.getCacheKey() != null && request.getCacheKey().length() > MAX_CACHE_KEY_LENGTH) {
            violations.add(new FieldViolation("cacheKey", "must be at most " + MAX_CACHE_KEY_LENGTH + " characters"));
        }

        if (!violations.isEmpty()) {
            throw new InvalidSearchRequestException("invalid search parameters", violations);
        }

        return new SearchCriteria(
            request.getQuery(),
            request.getCategories(),
            request.getBodyParts(),
            request.getEquipment(),
            request.getDifficulty(),
            request.getTherapeuticGoals(),
            durationMin,
            durationMax,
            request.getAiCategorized(),
            minConfidence,
            Boolean.TRUE.equals(request.getHasMedia()),
            request.getApproved() == null || request.getApproved(),
            sortBy,
            sortOrder,
            limit,
            offset,
            Boolean.TRUE.equals(request.getIncludeMetadata()),
            Boolean.TRUE.equals(request.getIncludeMedia()),
            request.getFuzzyMatch() == null || request.getFuzzyMatch(),
            request.getCacheKey()
        );
    }

    private void checkValues(String field, List<String> values, List<FieldViolation> violations) {
        if (values == null) {
            return;
        }
        for (int i = 0; i < values.size(); i++) {
            if (values.get(i) == null) {
                violations.add(new FieldViolation(field + "[" + i + "]", "must not be null"));
            }
        }
    }
}
