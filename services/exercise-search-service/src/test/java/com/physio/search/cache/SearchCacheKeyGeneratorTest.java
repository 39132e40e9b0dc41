package com.physio.search.cache;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.physio.search.query.SearchCriteria;
import com.physio.search.query.SortField;
import com.physio.search.query.SortOrder;
import java.util.List;
import org.junit.jupiter.api.Test;

class SearchCacheKeyGeneratorTest {

    private final SearchCacheKeyGenerator generator =
        new SearchCacheKeyGenerator(new ObjectMapper(), new SearchCacheProperties());

    @Test
    void arrayOrderDoesNotChangeTheKey() {
        String first = generator.generate(criteria("ponte", List.of("joelho", "ombro"), null, 20));
        String second = generator.generate(criteria("ponte", List.of("ombro", "joelho"), null, 20));

        assertThat(first).isEqualTo(second);
        assertThat(first).startsWith("search:").hasSize("search:".length() + 64);
    }

    @Test
    void differentFiltersGiveDifferentKeys() {
        String base = generator.generate(criteria("ponte", List.of("joelho"), null, 20));

        assertThat(generator.generate(criteria("ponte", List.of("ombro"), null, 20))).isNotEqualTo(base);
        assertThat(generator.generate(criteria("prancha", List.of("joelho"), null, 20))).isNotEqualTo(base);
        assertThat(generator.generate(criteria("ponte", List.of("joelho"), null, 21))).isNotEqualTo(base);
    }

    @Test
    void explicitKeyIsUsedVerbatim() {
        assertThat(generator.generate(criteria("ponte", List.of(), "home-top", 20))).isEqualTo("search:explicit:home-top");
    }

    @Test
    void canonicalFieldsAreSortedCopies() {
        SearchCriteria criteria = criteria(null, List.of("ombro", "joelho"), null, 20);

        assertThat(generator.canonicalFields(criteria))
            .containsEntry("bodyParts", List.of("joelho", "ombro"))
            .containsEntry("sortBy", "relevance")
            .containsEntry("sortOrder", "desc")
            .containsEntry("isApproved", true);
        assertThat(criteria.bodyParts()).containsExactly("ombro", "joelho");
    }

    private static SearchCriteria criteria(String query, List<String> bodyParts, String cacheKey, int limit) {
        return new SearchCriteria(
            query, null, bodyParts, null, null, null, null, null, null, null,
            false, true, SortField.RELEVANCE, SortOrder.DESC, limit, 0, false, false, true, cacheKey
        );
    }
}
