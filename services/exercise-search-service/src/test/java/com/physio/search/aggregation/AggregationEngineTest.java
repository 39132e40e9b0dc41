package com.physio.search.aggregation;

import static com.physio.search.support.TestExercises.exercise;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.entry;

import com.physio.search.predicate.ListOverlaps;
import com.physio.search.predicate.PredicateSet;
import com.physio.search.predicate.StatusEquals;
import com.physio.search.predicate.ValueIn;
import com.physio.search.store.ExerciseRecord;
import com.physio.search.store.ListFacet;
import com.physio.search.store.ScalarFacet;
import com.physio.search.support.InMemoryExerciseStore;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class AggregationEngineTest {

    private final List<ExerciseRecord> records = List.of(
        exercise("1", "Agachamento").category("fortalecimento").difficulty("iniciante")
            .bodyParts("joelho", "quadril").equipment("halter").build(),
        exercise("2", "Ponte").category("fortalecimento").difficulty("intermediario")
            .bodyParts("quadril").build(),
        exercise("3", "Alongamento de ombro").category("alongamento").difficulty("iniciante")
            .bodyParts("ombro").equipment("faixa", "bastão").build(),
        exercise("4", "Prancha").category("fortalecimento").status("pending")
            .bodyParts("core").build()
    );

    private final AggregationEngine engine = new AggregationEngine(new InMemoryExerciseStore(records), 20);

    @Test
    void facetFiltersDoNotNarrowCounts() {
        PredicateSet predicates = PredicateSet.of(List.of(
            new StatusEquals(StatusEquals.APPROVED),
            new ValueIn(ScalarFacet.CATEGORY, List.of("alongamento")),
            new ListOverlaps(ListFacet.BODY_PARTS, List.of("ombro"))
        ));

        FacetCounts counts = engine.aggregate(predicates);

        assertThat(counts.categories()).containsOnly(
            entry("fortalecimento", 2L),
            entry("alongamento", 1L)
        );
        assertThat(counts.difficulties()).containsEntry("iniciante", 2L).containsEntry("intermediario", 1L);
        assertThat(counts.bodyParts()).doesNotContainKey("core");
        assertThat(counts.therapeuticGoals()).isEmpty();
    }

    @Test
    void listFacetCountsEachValueOnce() {
        FacetCounts counts = engine.aggregate(PredicateSet.of(List.of(new StatusEquals(StatusEquals.APPROVED))));

        assertThat(counts.bodyParts()).containsEntry("quadril", 2L).containsEntry("joelho", 1L).containsEntry("ombro", 1L);
        long bodyPartSum = counts.bodyParts().values().stream().mapToLong(Long::longValue).sum();
        assertThat(bodyPartSum).isGreaterThanOrEqualTo(3L);
        assertThat(counts.equipment()).containsOnlyKeys("halter", "faixa", "bastão");
    }

    @Test
    void listFacetsAreCappedByLimit() {
        List<ExerciseRecord> many = new ArrayList<>();
        for (int i = 0; i < 30; i++) {
            many.add(exercise(String.valueOf(i), "Exercício " + i).bodyParts("parte-" + i).build());
        }
        AggregationEngine capped = new AggregationEngine(new InMemoryExerciseStore(many), AggregationEngine.DEFAULT_LIST_FACET_LIMIT);

        FacetCounts counts = capped.aggregate(PredicateSet.of(List.of()));

        assertThat(counts.bodyParts()).hasSize(20);
        assertThat(counts.categories()).isEmpty();
    }
}
