package com.physio.search.api;

import com.physio.search.api.dto.CacheStatsResponse;
import com.physio.search.api.dto.MessageResponse;
import com.physio.search.api.dto.SearchRequest;
import com.physio.search.api.dto.SearchResponse;
import com.physio.search.service.ExerciseSearchService;
import com.physio.search.service.FieldViolation;
import com.physio.search.service.InvalidSearchRequestException;
import java.util.List;
import java.util.Map;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class SearchController {
    static final String OPTIMIZED_PATH = "/api/exercises/search-optimized";
    static final String ACTION_CACHE_STATS = "cache-stats";
    static final String ACTION_CLEAR_CACHE = "clear-cache";

    private final ExerciseSearchService searchService;

    public SearchController(ExerciseSearchService searchService) {
        this.searchService = searchService;
    }

    @GetMapping("/health")
    public Map<String, String> health() {
        return Map.of("status", "ok");
    }

    @PostMapping({"/exercises/search", OPTIMIZED_PATH})
    public ResponseEntity<SearchResponse> search(@RequestBody(required = false) SearchRequest request) {
        return ResponseEntity.ok(searchService.search(request));
    }

    @GetMapping("/exercises/search/cache/stats")
    public ResponseEntity<CacheStatsResponse> cacheStats() {
        return ResponseEntity.ok(searchService.cacheStats());
    }

    @DeleteMapping("/exercises/search/cache")
    public ResponseEntity<MessageResponse> clearCache() {
        searchService.clearCache();
        return ResponseEntity.ok(new MessageResponse("search cache cleared"));
    }

    @GetMapping(OPTIMIZED_PATH)
    public ResponseEntity<?> action(@RequestParam(value = "action", required = false) String action) {
        if (ACTION_CACHE_STATS.equals(action)) {
            return cacheStats();
        }
        if (ACTION_CLEAR_CACHE.equals(action)) {
            return clearCache();
        }
        throw unknownAction(action);
    }

    @DeleteMapping(OPTIMIZED_PATH)
    public ResponseEntity<MessageResponse> deleteAction(@RequestParam(value = "action", required = false) String action) {
        if (ACTION_CLEAR_CACHE.equals(action)) {
            return clearCache();
        }
        throw unknownAction(action);
    }

    private static InvalidSearchRequestException unknownAction(String action) {
        return new InvalidSearchRequestException(
            "unknown action",
            List.of(new FieldViolation("action", "unsupported value: " + action))
        );
    }
}
