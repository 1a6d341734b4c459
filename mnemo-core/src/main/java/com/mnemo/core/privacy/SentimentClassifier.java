package com.mnemo.core.privacy;

import com.google.common.base.Strings;

import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Lexicon based sentiment scoring with a separate signal for volatile (heated or urgent) messages
 */
public class SentimentClassifier {
    private static final Set<String> POSITIVE = Set.of(
            "good", "great", "thanks", "thank", "love", "awesome", "excellent", "happy", "perfect", "nice",
            "helpful", "glad", "appreciate", "amazing", "wonderful", "works");
    private static final Set<String> NEGATIVE = Set.of(
            "bad", "terrible", "hate", "awful", "wrong", "broken", "angry", "annoyed", "frustrated", "useless",
            "horrible", "worst", "fail", "failed", "failing", "disappointed", "upset", "stupid");
    private static final Set<String> URGENCY = Set.of(
            "urgent", "asap", "immediately", "emergency", "critical");

    private static final Pattern EXCLAMATION_RUN = Pattern.compile("!{2,}");
    private static final Pattern WORD_SPLITTER = Pattern.compile("\\s+");
    private static final Pattern NON_LETTERS = Pattern.compile("[^\\p{L}]");
    private static final int MIN_SHOUTED_LETTERS = 3;

    public SentimentResult classify(String text) {
        if (Strings.isNullOrEmpty(text)) {
            return SentimentResult.NEUTRAL;
        }
        int positive = 0;
        int negative = 0;
        int volatileHits = 0;
        for (final var rawWord : WORD_SPLITTER.split(text.trim())) {
            final var letters = NON_LETTERS.matcher(rawWord).replaceAll("");
            if (letters.isEmpty()) {
                continue;
            }
            final var word = letters.toLowerCase(Locale.ROOT);
            if (POSITIVE.contains(word)) {
                positive++;
            }
            if (NEGATIVE.contains(word)) {
                negative++;
            }
            if (URGENCY.contains(word) || isShouted(letters)) {
                volatileHits++;
            }
        }
        final var runs = EXCLAMATION_RUN.matcher(text);
        while (runs.find()) {
            volatileHits++;
        }
        final var hits = positive + negative;
        final var score = hits == 0 ? 0.0 : (double) (positive - negative) / hits;
        return SentimentResult.builder()
                .label(label(score, negative, volatileHits))
                .score(score)
                .positiveHits(positive)
                .negativeHits(negative)
                .volatileHits(volatileHits)
                .build();
    }

    private static SentimentLabel label(double score, int negative, int volatileHits) {
        if (volatileHits >= 2 || (negative > 0 && volatileHits > 0)) {
            return SentimentLabel.VOLATILE;
        }
        if (score > 0) {
            return SentimentLabel.POSITIVE;
        }
        if (score < 0) {
            return SentimentLabel.NEGATIVE;
        }
        return SentimentLabel.NEUTRAL;
    }

    private static boolean isShouted(String letters) {
        return letters.length() >= MIN_SHOUTED_LETTERS
                && letters.equals(letters.toUpperCase(Locale.ROOT))
                && !letters.equals(letters.toLowerCase(Locale.ROOT));
    }
}
