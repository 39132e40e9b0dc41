package com.physio.search.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

public class SearchRequest {
    private String query;
    private List<String> categories;
    private List<String> bodyParts;
    private List<String> equipment;
    private List<String> difficulty;
    private DurationRange duration;
    private List<String> therapeuticGoals;
    private Boolean aiCategorized;
    private Double minConfidence;
    private Boolean hasMedia;

    @JsonProperty("isApproved")
    private Boolean approved;

    private String sortBy;
    private String sortOrder;
    private Integer limit;
    private Integer offset;
    private Boolean includeMetadata;
    private Boolean includeMedia;
    private Boolean fuzzyMatch;
    private String cacheKey;

    public String getQuery() {
        return query;
    }

    public void setQuery(String query) {
        this.query = query;
    }

    public List<String> getCategories() {
        return categories;
    }

    public void setCategories(List<String> categories) {
        this.categories = categories;
    }

    public List<String> getBodyParts() {
        return bodyParts;
    }

    public void setBodyParts(List<String> bodyParts) {
        this.bodyParts = bodyParts;
    }

    public List<String> getEquipment() {
        return equipment;
    }

    public void setEquipment(List<String> equipment) {
        this.equipment = equipment;
    }

    public List<String> getDifficulty() {
        return difficulty;
    }

    public void setDifficulty(List<String> difficulty) {
        this.difficulty = difficulty;
    }

    public DurationRange getDuration() {
        return duration;
    }

    public void setDuration(DurationRange duration) {
        this.duration = duration;
    }

    public List<String> getTherapeuticGoals() {
        return therapeuticGoals;
    }

    public void setTherapeuticGoals(List<String> therapeuticGoals) {
        this.therapeuticGoals = therapeuticGoals;
    }

    public Boolean getAiCategorized() {
        return aiCategorized;
    }

    public void setAiCategorized(Boolean aiCategorized) {
        this.aiCategorized = aiCategorized;
    }

    public Double getMinConfidence() {
        return minConfidence;
    }

    public void setMinConfidence(Double minConfidence) {
        this.minConfidence = minConfidence;
    }

    public Boolean getHasMedia() {
        return hasMedia;
    }

    public void setHasMedia(Boolean hasMedia) {
        this.hasMedia = hasMedia;
    }

    public Boolean getApproved() {
        return approved;
    }

    public void setApproved(Boolean approved) {
        this.approved = approved;
    }

    public String getSortBy() {
        return sortBy;
    }

    public void setSortBy(String sortBy) {
        this.sortBy = sortBy;
    }

    public String getSortOrder() {
        return sortOrder;
    }

    public void setSortOrder(String sortOrder) {
        this.sortOrder = sortOrder;
    }

    public Integer getLimit() {
        return limit;
    }

    public void setLimit(Integer limit) {
        this.limit = limit;
    }

    public Integer getOffset() {
        return offset;
    }

    public void setOffset(Integer offset) {
        this.offset = offset;
    }

    public Boolean getIncludeMetadata() {
        return includeMetadata;
    }

    public void setIncludeMetadata(Boolean includeMetadata) {
        this.includeMetadata = includeMetadata;
    }

    public Boolean getIncludeMedia() {
        return includeMedia;
    }

    public void setIncludeMedia(Boolean includeMedia) {
        this.includeMedia = includeMedia;
    }

    public Boolean getFuzzyMatch() {
        return fuzzyMatch;
    }

    public void setFuzzyMatch(Boolean fuzzyMatch) {
        this.fuzzyMatch = fuzzyMatch;
    }

    public String getCacheKey() {
        return cacheKey;
    }

    public void setCacheKey(String cacheKey) {
        this.cacheKey = cacheKey;
    }

    public static class DurationRange {
        private Integer min;
        private Integer max;

        public DurationRange() {
        }

        public DurationRange(Integer min, Integer max) {
            this.min = min;
            this.max = max;
        }

        public Integer getMin() {
            return min;
        }

        public void setMin(Integer min) {
            this.min = min;
        }

        public Integer getMax() {
            return max;
        }

        public void setMax(Integer max) {
            this.max = max;
        }
    }
}
