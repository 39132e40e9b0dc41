package com.physio.search.predicate;

import com.physio.search.query.QueryNormalizer;
import com.physio.search.query.SearchCriteria;
import com.physio.search.store.ListFacet;
import com.physio.search.store.ScalarFacet;
import java.util.ArrayList;
import java.util.List;
import org.springframework.stereotype.Component;

@Component
public class PredicateBuilder {
    private final QueryNormalizer queryNormalizer;

    public PredicateBuilder(QueryNormalizer queryNormalizer) {
        this.queryNormalizer = queryNormalizer;
    }

    public PredicateSet build(SearchCriteria criteria) {
        List<ExercisePredicate> predicates = new ArrayList<>();

        if (criteria.approvedOnly()) {
            predicates.add(new StatusEquals(StatusEquals.APPROVED));
        }
        if (criteria.aiCategorized() != null) {
            predicates.add(new AiCategorizedEquals(criteria.aiCategorized()));
        }
        if (criteria.minConfidence() != null) {
            predicates.add(new MinConfidence(criteria.minConfidence()));
        }
        if (!criteria.categories().isEmpty()) {
            predicates.add(new ValueIn(ScalarFacet.CATEGORY, criteria.categories()));
        }
        if (!criteria.difficulties().isEmpty()) {
            predicates.add(new ValueIn(ScalarFacet.DIFFICULTY, criteria.difficulties()));
        }
        if (criteria.hasDurationRange()) {
            predicates.add(new DurationBetween(criteria.durationMin(), criteria.durationMax()));
        }
        if (!criteria.bodyParts().isEmpty()) {
            predicates.add(new ListOverlaps(ListFacet.BODY_PARTS, criteria.bodyParts()));
        }
        if (!criteria.equipment().isEmpty()) {
            predicates.add(new ListOverlaps(ListFacet.EQUIPMENT, criteria.equipment()));
        }
        if (!criteria.therapeuticGoals().isEmpty()) {
            predicates.add(new GoalsContain(criteria.therapeuticGoals()));
        }
        if (criteria.hasMedia()) {
            predicates.add(new HasMedia());
        }
        if (criteria.hasQuery()) {
            String query = criteria.query();
            List<String> variants = queryNormalizer.expand(query, criteria.fuzzyMatch());
            predicates.add(new TextMatch(query, variants, criteria.fuzzyMatch()));
        }
        return PredicateSet.of(predicates);
    }
}
