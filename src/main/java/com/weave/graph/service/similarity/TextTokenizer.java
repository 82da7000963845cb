package com.weave.graph.service.similarity;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Turns free text into a normalised token set for keyword similarity.
 *
 * <ul>
 *   <li>camelCase and PascalCase boundaries are split before lowercasing</li>
 *   <li>whitespace and punctuation act as separators</li>
 *   <li>tokens shorter than two characters and stop-words are dropped</li>
 * </ul>
 *
 * {@code tokenize("useContextManager")} yields {@code [context, manager]}.
 */
public final class TextTokenizer {

    private static final Pattern LOWER_UPPER = Pattern.compile("([a-z])([A-Z])");
    private static final Pattern ACRONYM_WORD = Pattern.compile("([A-Z]+)([A-Z][a-z])");
    private static final Pattern SEPARATORS =
            Pattern.compile("[\\s\\-_/\\\\.,;:()\\[\\]{}'\"!?@#$%^&*+=<>|~`]+");

    private static final int MIN_TOKEN_LENGTH = 2;

    static final Set<String> STOP_WORDS = Set.of(
            "a", "an", "the", "is", "are", "was", "were", "be", "been", "being",
            "have", "has", "had", "do", "does", "did", "will", "would", "could",
            "should", "may", "might", "shall", "can", "need", "dare", "ought",
            "for", "and", "nor", "but", "or", "yet", "so", "in", "on", "at",
            "to", "of", "by", "up", "as", "if", "it", "its", "with", "this",
            "that", "from", "not", "no", "vs", "via", "than", "then", "use",
            "using", "used"
    );

    private TextTokenizer() {
    }

    public static Set<String> tokenize(String text) {
        if (text == null || text.isBlank()) {
            return Set.of();
        }
        String expanded = LOWER_UPPER.matcher(text).replaceAll("$1 $2");
        expanded = ACRONYM_WORD.matcher(expanded).replaceAll("$1 $2");

        return Arrays.stream(SEPARATORS.split(expanded.toLowerCase(Locale.ROOT)))
                .filter(token -> token.length() >= MIN_TOKEN_LENGTH)
                .filter(token -> !STOP_WORDS.contains(token))
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }
}
