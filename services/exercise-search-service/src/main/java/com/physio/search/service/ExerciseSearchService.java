package com.physio.search.service;

import com.physio.search.aggregation.AggregationEngine;
import com.physio.search.aggregation.FacetCounts;
import com.physio.search.api.dto.CacheStatsResponse;
import com.physio.search.api.dto.SearchRequest;
import com.physio.search.api.dto.SearchResponse;
import com.physio.search.cache.SearchCacheKeyGenerator;
import com.physio.search.cache.SearchResultCache;
import com.physio.search.execution.SearchExecutor;
import com.physio.search.execution.SearchPage;
import com.physio.search.index.SearchIndexTracker;
import com.physio.search.predicate.ExercisePredicate;
import com.physio.search.predicate.PredicateBuilder;
import com.physio.search.predicate.PredicateSet;
import com.physio.search.predicate.TextMatch;
import com.physio.search.query.SearchCriteria;
import com.physio.search.ranking.RelevanceRanker;
import com.physio.search.ranking.ScoredExercise;
import com.physio.search.store.ExerciseRecord;
import com.physio.search.store.ExerciseStoreException;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

@Service
public class ExerciseSearchService {
    private static final Logger log = LoggerFactory.getLogger(ExerciseSearchService.class);

    private final SearchRequestValidator validator;
    private final PredicateBuilder predicateBuilder;
    private final SearchCacheKeyGenerator cacheKeyGenerator;
    private final SearchResultCache resultCache;
    private final SearchExecutor searchExecutor;
    private final AggregationEngine aggregationEngine;
    private final RelevanceRanker relevanceRanker;
    private final ResultAssembler resultAssembler;
    private final SearchIndexTracker indexTracker;
    private final ExecutorService searchPool;
    private final MeterRegistry meterRegistry;

    public ExerciseSearchService(
        SearchRequestValidator validator,
        PredicateBuilder predicateBuilder,
        SearchCacheKeyGenerator cacheKeyGenerator,
        SearchResultCache resultCache,
        SearchExecutor searchExecutor,
        AggregationEngine aggregationEngine,
        RelevanceRanker relevanceRanker,
        ResultAssembler resultAssembler,
        SearchIndexTracker indexTracker,
        @Qualifier("searchThreadPool") ExecutorService searchPool,
        MeterRegistry meterRegistry
    ) {
        this.validator = validator;
        this.predicateBuilder = predicateBuilder;
        this.cacheKeyGenerator = cacheKeyGenerator;
        this.resultCache = resultCache;
        this.searchExecutor = searchExecutor;
        this.aggregationEngine = aggregationEngine;
        this.relevanceRanker = relevanceRanker;
        this.resultAssembler = resultAssembler;
        this.indexTracker = indexTracker;
        this.searchPool = searchPool;
        this.meterRegistry = meterRegistry;
    }

    public SearchResponse search(SearchRequest request) {
        long started = System.nanoTime();
        SearchCriteria criteria = validator.validate(request);
        PredicateSet predicates = predicateBuilder.build(criteria);

        String cacheKey = cacheKeyGenerator.generate(criteria);
        Optional<SearchResponse> cached = resultCache.get(cacheKey);
        if (cached.isPresent()) {
            SearchResponse.SearchMetadata metadata = cached.get().getSearchMetadata().copy();
            metadata.setQueryTime(elapsedMs(started));
            metadata.setCacheHit(true);
            return cached.get().withMetadata(metadata);
        }

        indexTracker.refreshIfStale();

        CompletableFuture<SearchPage> pageFuture =
            CompletableFuture.supplyAsync(() -> searchExecutor.execute(predicates, criteria), searchPool);
        CompletableFuture<FacetCounts> facetsFuture =
            CompletableFuture.supplyAsync(() -> aggregationEngine.aggregate(predicates), searchPool);

        SearchPage page;
        FacetCounts facets;
        try {
            page = await(pageFuture);
            facets = await(facetsFuture);
        } catch (RuntimeException e) {
            pageFuture.cancel(true);
            facetsFuture.cancel(true);
            throw e;
        }

        boolean ranked = criteria.hasQuery();
        List<String> normalizedQueries = normalizedQueries(predicates);
        List<ScoredExercise> exercises = ranked
            ? relevanceRanker.rank(page.exercises(), criteria.query(), criteria.fuzzyMatch())
            : unscored(page.exercises());

        SearchResponse response = resultAssembler.assemble(
            criteria,
            exercises,
            ranked,
            facets,
            page.total(),
            normalizedQueries,
            elapsedMs(started),
            resultCache.size()
        );
        resultCache.put(cacheKey, response);

        String algorithm = response.getSearchMetadata().getAlgorithmUsed();
        meterRegistry.counter("exercise_search_requests_total", "algorithm", algorithm).increment();
        log.debug("exercise search algorithm={} total={} returned={}", algorithm, page.total(), exercises.size());
        return response;
    }

    public CacheStatsResponse cacheStats() {
        return new CacheStatsResponse(new CacheStatsResponse.Stats(
            resultCache.size(),
            indexTracker.getIndexedCount(),
            indexTracker.getLastRefreshedAt().toString()
        ));
    }

    public void clearCache() {
        resultCache.clear();
    }

    private static List<ScoredExercise> unscored(List<ExerciseRecord> records) {
        List<ScoredExercise> result = new ArrayList<>(records.size());
        for (ExerciseRecord record : records) {
            result.add(new ScoredExercise(record, 0.0));
        }
        return result;
    }

    private static List<String> normalizedQueries(PredicateSet predicates) {
        for (ExercisePredicate predicate : predicates.predicates()) {
            if (predicate instanceof TextMatch textMatch) {
                return textMatch.variants();
            }
        }
        return List.of();
    }

    private static <T> T await(CompletableFuture<T> future) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ExerciseStoreException("search interrupted", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new ExerciseStoreException("search failed", cause);
        }
    }

    private static double elapsedMs(long startedNanos) {
        return (System.nanoTime() - startedNanos) / 1_000_000.0;
    }
}
