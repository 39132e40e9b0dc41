package com.physio.search.query;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import org.springframework.stereotype.Component;

/**
 * Expands a free-text query into the variants used for fuzzy matching: the query itself, its
 * longer tokens, Portuguese suffix stems and synonyms.
 */
@Component
public class QueryNormalizer {
    private static final int MIN_TOKEN_LENGTH = 3;

    private static final Map<String, List<String>> SYNONYMS = buildSynonyms();

    // suffix -> replacement, checked independently so "-amento" yields both stems
    private static final Map<String, String> SUFFIX_STEMS = buildSuffixStems();

    public List<String> expand(String rawQuery, boolean fuzzy) {
        if (rawQuery == null) {
            return List.of();
        }
        if (!fuzzy) {
            return List.of(rawQuery);
        }

        Set<String> variants = new LinkedHashSet<>();
        variants.add(rawQuery);

        List<String> tokens = tokenize(rawQuery);
        variants.addAll(tokens);

        for (String token : tokens) {
            for (Map.Entry<String, String> stem : SUFFIX_STEMS.entrySet()) {
                String suffix = stem.getKey();
                if (token.endsWith(suffix)) {
                    variants.add(token.substring(0, token.length() - suffix.length()) + stem.getValue());
                }
            }
        }

        variants.addAll(synonymsOf(tokens));

        variants.remove("");
        return List.copyOf(variants);
    }

    /**
     * Synonym expansions of the query tokens only, without the query, its tokens or suffix stems.
     */
    public List<String> synonyms(String rawQuery) {
        if (rawQuery == null) {
            return List.of();
        }
        return List.copyOf(synonymsOf(tokenize(rawQuery)));
    }

    private static Set<String> synonymsOf(List<String> tokens) {
        Set<String> expansions = new LinkedHashSet<>();
        for (String token : tokens) {
            for (Map.Entry<String, List<String>> entry : SYNONYMS.entrySet()) {
                String key = entry.getKey();
                List<String> synonyms = entry.getValue();
                if (key.contains(token) || token.contains(key)) {
                    expansions.addAll(synonyms);
                }
                for (String synonym : synonyms) {
                    if (synonym.contains(token) || token.contains(synonym)) {
                        expansions.add(key);
                        break;
                    }
                }
            }
        }
        return expansions;
    }

    static List<String> tokenize(String rawQuery) {
        List<String> tokens = new ArrayList<>();
        for (String part : rawQuery.toLowerCase(Locale.ROOT).trim().split("\\s+")) {
            if (part.length() >= MIN_TOKEN_LENGTH) {
                tokens.add(part);
            }
        }
        return tokens;
    }

    private static Map<String, List<String>> buildSynonyms() {
        Map<String, List<String>> synonyms = new LinkedHashMap<>();
        synonyms.put("fortalecimento", List.of("força", "fortalecer", "tonificar"));
        synonyms.put("alongamento", List.of("flexibilidade", "esticar", "alongar"));
        synonyms.put("equilibrio", List.of("propriocepção", "estabilidade"));
        synonyms.put("cardio", List.of("aeróbico", "cardiovascular"));
        synonyms.put("reabilitação", List.of("recuperação", "fisioterapia"));
        return Collections.unmodifiableMap(synonyms);
    }

    private static Map<String, String> buildSuffixStems() {
        Map<String, String> stems = new LinkedHashMap<>();
        stems.put("ção", "car");
        stems.put("mento", "");
        stems.put("amento", "ar");
        return Collections.unmodifiableMap(stems);
    }
}
