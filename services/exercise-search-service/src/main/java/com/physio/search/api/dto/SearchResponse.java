package com.physio.search.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;
import java.util.Map;

/**
 * Search envelope. Instances stored in the result cache are shared between requests and must not be
 * modified; use {@link #withMetadata(SearchMetadata)} to vary the metadata.
 */
public class SearchResponse {
    private boolean success = true;
    private List<ExerciseHit> exercises;
    private Aggregations aggregations;
    private Pagination pagination;
    private SearchMetadata searchMetadata;

    public SearchResponse withMetadata(SearchMetadata metadata) {
        SearchResponse copy = new SearchResponse();
        copy.setSuccess(success);
        copy.setExercises(exercises);
        copy.setAggregations(aggregations);
        copy.setPagination(pagination);
        copy.setSearchMetadata(metadata);
        return copy;
    }

    public boolean isSuccess() {
        return success;
    }

    public void setSuccess(boolean success) {
        this.success = success;
    }

    public List<ExerciseHit> getExercises() {
        return exercises;
    }

    public void setExercises(List<ExerciseHit> exercises) {
        this.exercises = exercises;
    }

    public Aggregations getAggregations() {
        return aggregations;
    }

    public void setAggregations(Aggregations aggregations) {
        this.aggregations = aggregations;
    }

    public Pagination getPagination() {
        return pagination;
    }

    public void setPagination(Pagination pagination) {
        this.pagination = pagination;
    }

    public SearchMetadata getSearchMetadata() {
        return searchMetadata;
    }

    public void setSearchMetadata(SearchMetadata searchMetadata) {
        this.searchMetadata = searchMetadata;
    }

    public static class Aggregations {
        private Map<String, Long> categories;
        private Map<String, Long> bodyParts;
        private Map<String, Long> equipment;
        private Map<String, Long> difficulties;
        private Map<String, Long> therapeuticGoals;

        public Map<String, Long> getCategories() {
            return categories;
        }

        public void setCategories(Map<String, Long> categories) {
            this.categories = categories;
        }

        public Map<String, Long> getBodyParts() {
            return bodyParts;
        }

        public void setBodyParts(Map<String, Long> bodyParts) {
            this.bodyParts = bodyParts;
        }

        public Map<String, Long> getEquipment() {
            return equipment;
        }

        public void setEquipment(Map<String, Long> equipment) {
            this.equipment = equipment;
        }

        public Map<String, Long> getDifficulties() {
            return difficulties;
        }

        public void setDifficulties(Map<String, Long> difficulties) {
            this.difficulties = difficulties;
        }

        public Map<String, Long> getTherapeuticGoals() {
            return therapeuticGoals;
        }

        public void setTherapeuticGoals(Map<String, Long> therapeuticGoals) {
            this.therapeuticGoals = therapeuticGoals;
        }
    }

    public static class Pagination {
        private long total;
        private int limit;
        private int offset;
        private boolean hasMore;

        public Pagination() {
        }

        public Pagination(long total, int limit, int offset, boolean hasMore) {
            this.total = total;
            this.limit = limit;
            this.offset = offset;
            this.hasMore = hasMore;
        }

        public long getTotal() {
            return total;
        }

        public void setTotal(long total) {
            this.total = total;
        }

        public int getLimit() {
            return limit;
        }

        public void setLimit(int limit) {
            this.limit = limit;
        }

        public int getOffset() {
            return offset;
        }

        public void setOffset(int offset) {
            this.offset = offset;
        }

        public boolean isHasMore() {
            return hasMore;
        }

        public void setHasMore(boolean hasMore) {
            this.hasMore = hasMore;
        }
    }

    public static class SearchMetadata {
        private double queryTime;
        private boolean cacheHit;
        private String algorithmUsed;
        private int totalIndexed;

        @JsonInclude(JsonInclude.Include.NON_NULL)
        private List<String> normalizedQueries;

        public SearchMetadata copy() {
            SearchMetadata copy = new SearchMetadata();
            copy.setQueryTime(queryTime);
            copy.setCacheHit(cacheHit);
            copy.setAlgorithmUsed(algorithmUsed);
            copy.setTotalIndexed(totalIndexed);
            copy.setNormalizedQueries(normalizedQueries);
            return copy;
        }

        public double getQueryTime() {
            return queryTime;
        }

        public void setQueryTime(double queryTime) {
            this.queryTime = queryTime;
        }

        public boolean isCacheHit() {
            return cacheHit;
        }

        public void setCacheHit(boolean cacheHit) {
            this.cacheHit = cacheHit;
        }

        public String getAlgorithmUsed() {
            return algorithmUsed;
        }

        public void setAlgorithmUsed(String algorithmUsed) {
            this.algorithmUsed = algorithmUsed;
        }

        public int getTotalIndexed() {
            return totalIndexed;
        }

        public void setTotalIndexed(int totalIndexed) {
            this.totalIndexed = totalIndexed;
        }

        public List<String> getNormalizedQueries() {
            return normalizedQueries;
        }

        public void setNormalizedQueries(List<String> normalizedQueries) {
            this.normalizedQueries = normalizedQueries;
        }
    }
}
