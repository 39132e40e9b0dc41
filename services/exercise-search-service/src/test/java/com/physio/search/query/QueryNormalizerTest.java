package com.physio.search.query;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import org.junit.jupiter.api.Test;

class QueryNormalizerTest {

    private final QueryNormalizer normalizer = new QueryNormalizer();

    @Test
    void fortalecimentoExpandsToItsSynonyms() {
        List<String> variants = normalizer.expand("fortalecimento", true);

        assertThat(variants).startsWith("fortalecimento");
        assertThat(variants).contains("força", "fortalecer", "tonificar");
        assertThat(variants).doesNotHaveDuplicates();
    }

    @Test
    void synonymMatchesBackToItsKey() {
        List<String> variants = normalizer.expand("exercicio de flexibilidade", true);

        assertThat(variants).contains("exercicio de flexibilidade", "exercicio", "flexibilidade", "alongamento");
        assertThat(variants).doesNotContain("de");
    }

    @Test
    void suffixStemsAreAdded() {
        assertThat(normalizer.expand("reabilitação", true)).contains("reabilitacar");
        assertThat(normalizer.expand("alongamento", true)).contains("alonga", "alongar");
    }

    @Test
    void synonymsExcludeTheQueryAndItsStems() {
        assertThat(normalizer.synonyms("alongamento")).containsExactly("flexibilidade", "esticar", "alongar");
        assertThat(normalizer.synonyms("fortalecimento")).containsExactly("força", "fortalecer", "tonificar");
        assertThat(normalizer.synonyms(null)).isEmpty();
    }

    @Test
    void exactModeKeepsOnlyTheLiteralQuery() {
        assertThat(normalizer.expand("Fortalecimento de Joelho", false)).containsExactly("Fortalecimento de Joelho");
    }

    @Test
    void shortOrMissingInputNeverFails() {
        assertThat(normalizer.expand("ab", true)).containsExactly("ab");
        assertThat(normalizer.expand(null, true)).isEmpty();
    }

    @Test
    void tokenizeLowercasesAndDropsShortWords() {
        assertThat(QueryNormalizer.tokenize("  Dor  NO Ombro ")).containsExactly("dor", "ombro");
    }
}
