package com.physio.search.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.physio.search.query.SearchCriteria;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Derives the cache key of a search. Array filters are sorted first, so the order in which a
 * client lists values never changes the key; any other difference does.
 */
@Component
public class SearchCacheKeyGenerator {
    private static final Logger log = LoggerFactory.getLogger(SearchCacheKeyGenerator.class);
    private static final String EXPLICIT_SEGMENT = "explicit:";

    private final ObjectMapper objectMapper;
    private final SearchCacheProperties properties;

    public SearchCacheKeyGenerator(ObjectMapper objectMapper, SearchCacheProperties properties) {
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    /**
     * @return the key, or null when none could be built and the cache should be bypassed
     */
    public String generate(SearchCriteria criteria) {
        if (criteria.cacheKey() != null && !criteria.cacheKey().isBlank()) {
            return properties.getKeyPrefix() + EXPLICIT_SEGMENT + criteria.cacheKey().trim();
        }
        try {
            return properties.getKeyPrefix() + CacheKeyUtil.hashJson(objectMapper, canonicalFields(criteria));
        } catch (JsonProcessingException e) {
            log.debug("search cache key serialization failed; bypassing cache", e);
            return null;
        }
    }

    Map<String, Object> canonicalFields(SearchCriteria criteria) {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("query", criteria.query());
        fields.put("categories", sorted(criteria.categories()));
        fields.put("bodyParts", sorted(criteria.bodyParts()));
        fields.put("equipment", sorted(criteria.equipment()));
        fields.put("difficulty", sorted(criteria.difficulties()));
        fields.put("durationMin", criteria.durationMin());
        fields.put("durationMax", criteria.durationMax());
        fields.put("therapeuticGoals", sorted(criteria.therapeuticGoals()));
        fields.put("aiCategorized", criteria.aiCategorized());
        fields.put("minConfidence", criteria.minConfidence());
        fields.put("hasMedia", criteria.hasMedia());
        fields.put("isApproved", criteria.approvedOnly());
        fields.put("sortBy", criteria.sortBy().wireValue());
        fields.put("sortOrder", criteria.sortOrder().wireValue());
        fields.put("limit", criteria.limit());
        fields.put("offset", criteria.offset());
        fields.put("fuzzyMatch", criteria.fuzzyMatch());
        fields.put("includeMedia", criteria.includeMedia());
        fields.put("includeMetadata", criteria.includeMetadata());
        return fields;
    }

    private static List<String> sorted(List<String> values) {
        List<String> copy = new ArrayList<>(values);
        Collections.sort(copy);
        return copy;
    }
}
