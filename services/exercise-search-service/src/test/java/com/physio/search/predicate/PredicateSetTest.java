package com.physio.search.predicate;

import static com.physio.search.support.TestExercises.exercise;
import static org.assertj.core.api.Assertions.assertThat;

import com.physio.search.store.ListFacet;
import com.physio.search.store.ScalarFacet;
import java.util.List;
import org.junit.jupiter.api.Test;

class PredicateSetTest {

    @Test
    void withoutFacetFiltersKeepsEverythingElseInOrder() {
        PredicateSet predicates = PredicateSet.of(List.of(
            new StatusEquals(StatusEquals.APPROVED),
            new ValueIn(ScalarFacet.CATEGORY, List.of("cardio")),
            new MinConfidence(70.0),
            new ListOverlaps(ListFacet.EQUIPMENT, List.of("faixa")),
            new GoalsContain(List.of("mobilidade")),
            new ValueIn(ScalarFacet.DIFFICULTY, List.of("iniciante")),
            new ListOverlaps(ListFacet.BODY_PARTS, List.of("joelho")),
            new TextMatch("ponte", List.of("ponte"), true)
        ));

        PredicateSet base = predicates.withoutFacetFilters();

        assertThat(base.predicates()).containsExactly(
            new StatusEquals(StatusEquals.APPROVED),
            new MinConfidence(70.0),
            new TextMatch("ponte", List.of("ponte"), true)
        );
        assertThat(predicates.predicates()).hasSize(8);
    }

    @Test
    void emptySetMatchesEverything() {
        assertThat(PredicateSet.of(List.of()).isEmpty()).isTrue();
        assertThat(PredicateSet.of(null)).isSameAs(PredicateSet.of(List.of()));
        assertThat(PredicateSet.of(List.of()).matches(
            exercise("1", "Ponte").status("draft").build()
        )).isTrue();
    }

    @Test
    void equalSetsAreEqual() {
        PredicateSet left = PredicateSet.of(List.of(new HasMedia(), new AiCategorizedEquals(true)));
        PredicateSet right = PredicateSet.of(List.of(new HasMedia(), new AiCategorizedEquals(true)));

        assertThat(left).isEqualTo(right).hasSameHashCodeAs(right);
        assertThat(left.contains(FilterKind.MEDIA)).isTrue();
        assertThat(left.contains(FilterKind.TEXT)).isFalse();
    }
}
