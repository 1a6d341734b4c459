package com.mnemo.core.privacy;

import com.google.common.base.Strings;

import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Spots requests like "off the record" or "don't remember this"
 */
public class ForgetDirectiveDetector {
    private static final List<Pattern> DIRECTIVES = List.of(
            Pattern.compile("\\bdon['\u2019]?t\\s+(remember|store|save|log)\\s+this\\b", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\boff\\s+the\\s+record\\b", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\bno\\s+memory\\b", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\bforget\\s+this\\b", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\bprivate\\s+mode\\b", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\bthis\\s+is\\s+confidential\\b", Pattern.CASE_INSENSITIVE));

    /**
     * @param text Text to check
     * @return The first directive found, if any
     */
    public Optional<String> findDirective(String text) {
        if (Strings.isNullOrEmpty(text)) {
            return Optional.empty();
        }
        for (final var directive : DIRECTIVES) {
            final var matcher = directive.matcher(text);
            if (matcher.find()) {
                return Optional.of(matcher.group());
            }
        }
        return Optional.empty();
    }

    public boolean hasDirective(String text) {
        return findDirective(text).isPresent();
    }
}
