package com.physio.search.predicate;

import static com.physio.search.support.TestExercises.exercise;
import static org.assertj.core.api.Assertions.assertThat;

import com.physio.search.query.QueryNormalizer;
import com.physio.search.query.SearchCriteria;
import com.physio.search.query.SortField;
import com.physio.search.query.SortOrder;
import com.physio.search.store.ExerciseRecord;
import com.physio.search.store.ListFacet;
import com.physio.search.store.ScalarFacet;
import java.util.List;
import org.junit.jupiter.api.Test;

class PredicateBuilderTest {

    private final PredicateBuilder builder = new PredicateBuilder(new QueryNormalizer());

    @Test
    void defaultCriteriaOnlyRequireApproval() {
        PredicateSet predicates = builder.build(criteria(null, List.of(), List.of(), null, true, true));

        assertThat(predicates.predicates()).containsExactly(new StatusEquals(StatusEquals.APPROVED));
    }

    @Test
    void approvalFilterCanBeDisabled() {
        PredicateSet predicates = builder.build(criteria(null, List.of(), List.of(), null, false, true));

        assertThat(predicates.isEmpty()).isTrue();
    }

    @Test
    void valuesWithinAFilterAreOrAndFiltersAreAnd() {
        PredicateSet predicates = builder.build(
            criteria(null, List.of("fortalecimento", "alongamento"), List.of("joelho", "ombro"), null, true, true)
        );

        assertThat(predicates.predicates()).contains(
            new ValueIn(ScalarFacet.CATEGORY, List.of("fortalecimento", "alongamento")),
            new ListOverlaps(ListFacet.BODY_PARTS, List.of("joelho", "ombro"))
        );

        ExerciseRecord kneeStrength = exercise("1", "Agachamento").category("fortalecimento").bodyParts("joelho").build();
        ExerciseRecord shoulderStretch = exercise("2", "Rotação").category("alongamento").bodyParts("ombro", "pescoço").build();
        ExerciseRecord hipStrength = exercise("3", "Ponte").category("fortalecimento").bodyParts("quadril").build();
        ExerciseRecord kneeCardio = exercise("4", "Bicicleta").category("cardio").bodyParts("joelho").build();

        assertThat(predicates.matches(kneeStrength)).isTrue();
        assertThat(predicates.matches(shoulderStretch)).isTrue();
        assertThat(predicates.matches(hipStrength)).isFalse();
        assertThat(predicates.matches(kneeCardio)).isFalse();
    }

    @Test
    void unapprovedRecordsAreExcludedByDefault() {
        PredicateSet predicates = builder.build(criteria(null, List.of(), List.of(), null, true, true));

        assertThat(predicates.matches(exercise("1", "Ponte").status("pending").build())).isFalse();
        assertThat(predicates.matches(exercise("2", "Ponte").build())).isTrue();
    }

    @Test
    void fuzzyQueryCarriesExpandedVariants() {
        PredicateSet predicates = builder.build(criteria("fortalecimento", List.of(), List.of(), null, true, true));

        TextMatch text = (TextMatch) predicates.predicates().get(predicates.predicates().size() - 1);
        assertThat(text.fuzzy()).isTrue();
        assertThat(text.variants()).contains("fortalecimento", "força");
        assertThat(predicates.matches(exercise("1", "Agachamento de Força").build())).isTrue();
        assertThat(predicates.matches(exercise("2", "Caminhada").build())).isFalse();
    }

    @Test
    void exactQueryRequiresEveryWordInOneField() {
        PredicateSet predicates = builder.build(criteria("ponte glúteo", List.of(), List.of(), null, true, false));

        assertThat(predicates.matches(exercise("1", "Ponte de glúteo").build())).isTrue();
        assertThat(predicates.matches(exercise("2", "Ponte").description("ativa o glúteo").build())).isFalse();
        assertThat(predicates.matches(exercise("3", "Agachamento").description("ponte com foco no glúteo").build())).isTrue();
    }

    @Test
    void blankQueryAddsNoTextPredicate() {
        PredicateSet predicates = builder.build(criteria("   ", List.of(), List.of(), null, true, true));

        assertThat(predicates.contains(FilterKind.TEXT)).isFalse();
    }

    @Test
    void minConfidenceIsAppliedWheneverSpecified() {
        PredicateSet predicates = builder.build(criteria(null, List.of(), List.of(), 80.0, true, true));

        assertThat(predicates.predicates()).contains(new MinConfidence(80.0));
        assertThat(predicates.matches(exercise("1", "Ponte").aiConfidence(85.0).build())).isTrue();
        assertThat(predicates.matches(exercise("2", "Ponte").aiConfidence(50.0).build())).isFalse();
        assertThat(predicates.matches(exercise("3", "Ponte").build())).isFalse();
    }

    @Test
    void mediaAndTextAreIndependentConditions() {
        SearchCriteria criteria = new SearchCriteria(
            "ponte", null, null, null, null, null, null, null, null, null,
            true, true, SortField.RELEVANCE, SortOrder.DESC, 20, 0, false, false, true, null
        );
        PredicateSet predicates = builder.build(criteria);

        assertThat(predicates.contains(FilterKind.MEDIA)).isTrue();
        assertThat(predicates.contains(FilterKind.TEXT)).isTrue();
        assertThat(predicates.matches(exercise("1", "Ponte").build())).isFalse();
        assertThat(predicates.matches(exercise("2", "Agachamento").videoUrl("https://cdn/v.mp4").build())).isFalse();
        assertThat(predicates.matches(exercise("3", "Ponte").thumbnailUrl("https://cdn/t.png").build())).isTrue();
    }

    @Test
    void goalsMatchAnyValueIgnoringCase() {
        SearchCriteria criteria = new SearchCriteria(
            null, null, null, null, null, List.of("Mobilidade", "dor lombar"), null, null, null, null,
            false, true, SortField.RELEVANCE, SortOrder.DESC, 20, 0, false, false, true, null
        );
        PredicateSet predicates = builder.build(criteria);

        assertThat(predicates.matches(exercise("1", "Gato").goals("Alívio de DOR LOMBAR").build())).isTrue();
        assertThat(predicates.matches(exercise("2", "Ponte").goals("ganho de mobilidade").build())).isTrue();
        assertThat(predicates.matches(exercise("3", "Prancha").goals("estabilidade").build())).isFalse();
    }

    @Test
    void durationRangeIsInclusive() {
        SearchCriteria criteria = new SearchCriteria(
            null, null, null, null, null, null, 10, 20, null, null,
            false, false, SortField.RELEVANCE, SortOrder.DESC, 20, 0, false, false, true, null
        );
        PredicateSet predicates = builder.build(criteria);

        assertThat(predicates.matches(exercise("1", "a").duration(10).build())).isTrue();
        assertThat(predicates.matches(exercise("2", "b").duration(20).build())).isTrue();
        assertThat(predicates.matches(exercise("3", "c").duration(21).build())).isFalse();
        assertThat(predicates.matches(exercise("4", "d").build())).isFalse();
    }

    private static SearchCriteria criteria(
        String query,
        List<String> categories,
        List<String> bodyParts,
        Double minConfidence,
        boolean approvedOnly,
        boolean fuzzy
    ) {
        return new SearchCriteria(
            query, categories, bodyParts, null, null, null, null, null, null, minConfidence,
            false, approvedOnly, SortField.RELEVANCE, SortOrder.DESC, 20, 0, false, false, fuzzy, null
        );
    }
}
