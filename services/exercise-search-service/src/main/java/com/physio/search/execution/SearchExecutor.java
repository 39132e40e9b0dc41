package com.physio.search.execution;

import com.physio.search.predicate.PredicateSet;
import com.physio.search.query.SearchCriteria;
import com.physio.search.query.SortOrder;
import com.physio.search.store.ExerciseRecord;
import com.physio.search.store.ExerciseStore;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Fetches one page of candidates plus the total match count from the exercise store.
 */
@Component
public class SearchExecutor {
    private final ExerciseStore exerciseStore;

    public SearchExecutor(ExerciseStore exerciseStore) {
        this.exerciseStore = exerciseStore;
    }

    public SearchPage execute(PredicateSet predicates, SearchCriteria criteria) {
        SortSpec sort = resolveSort(criteria);
        List<ExerciseRecord> page = exerciseStore.find(
            predicates,
            sort,
            criteria.limit(),
            criteria.offset(),
            criteria.includeMedia()
        );
        long total = exerciseStore.count(predicates);
        return new SearchPage(page, total);
    }

    /**
     * Relevance with a query only pre-sorts by confidence; the ranker orders the page afterwards.
     */
    public static SortSpec resolveSort(SearchCriteria criteria) {
        SortOrder order = criteria.sortOrder();
        switch (criteria.sortBy()) {
            case RELEVANCE:
                if (criteria.hasQuery()) {
                    return SortSpec.of(SortSpec.key(SortColumn.AI_CONFIDENCE, SortOrder.DESC));
                }
                return SortSpec.of(
                    SortSpec.key(SortColumn.AI_CONFIDENCE, SortOrder.DESC),
                    SortSpec.key(SortColumn.CREATED_AT, SortOrder.DESC)
                );
            case NAME:
                return SortSpec.of(SortSpec.key(SortColumn.NAME, order));
            case CATEGORY:
                return SortSpec.of(
                    SortSpec.key(SortColumn.CATEGORY, order),
                    SortSpec.key(SortColumn.NAME, SortOrder.ASC)
                );
            case DIFFICULTY:
                return SortSpec.of(
                    SortSpec.key(SortColumn.DIFFICULTY, order),
                    SortSpec.key(SortColumn.NAME, SortOrder.ASC)
                );
            case AI_CONFIDENCE:
                return SortSpec.of(SortSpec.key(SortColumn.AI_CONFIDENCE, order));
            case CREATED_AT:
            default:
                return SortSpec.of(SortSpec.key(SortColumn.CREATED_AT, order));
        }
    }
}
