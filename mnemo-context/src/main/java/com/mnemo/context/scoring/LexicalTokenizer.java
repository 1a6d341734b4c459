package com.mnemo.context.scoring;

import com.google.common.base.Strings;

import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Splits text into lowercase alphanumeric terms of three or more characters, ignoring common English filler words
 */
public class LexicalTokenizer {
    private static final int MIN_TOKEN_LENGTH = 3;
    private static final Pattern NON_ALPHANUMERIC = Pattern.compile("[^a-z0-9\\s]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Set<String> STOP_WORDS = Set.of(
            "the", "and", "for", "are", "but", "not", "you", "all", "can", "had", "her", "was",
            "one", "our", "out", "day", "get", "has", "him", "his", "how", "man", "new", "now",
            "old", "see", "two", "way", "who", "boy", "did", "its", "let", "put", "say", "she",
            "too", "use", "that", "with", "this", "they", "have", "from", "will", "been", "said",
            "each", "about", "your", "more", "also", "into", "just", "like", "than", "then",
            "them", "some", "what", "when", "which", "there", "their", "would", "make", "could");

    public List<String> tokenize(String text) {
        if (Strings.isNullOrEmpty(text)) {
            return List.of();
        }
        final var cleaned = NON_ALPHANUMERIC.matcher(text.toLowerCase(Locale.ROOT)).replaceAll(" ");
        return Arrays.stream(WHITESPACE.split(cleaned))
                .filter(token -> token.length() >= MIN_TOKEN_LENGTH && !STOP_WORDS.contains(token))
                .toList();
    }

    /**
     * Share of query terms that appear in the content, in [0, 1]
     */
    public double overlap(String query, String content) {
        final var queryTokens = tokenize(query);
        if (queryTokens.isEmpty()) {
            return 0.0;
        }
        final var contentTokens = new HashSet<>(tokenize(content));
        final var matches = queryTokens.stream()
                .filter(contentTokens::contains)
                .count();
        return Math.min(1.0, (double) matches / queryTokens.size());
    }
}
