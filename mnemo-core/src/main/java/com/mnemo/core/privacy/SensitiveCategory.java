package com.mnemo.core.privacy;

import lombok.Getter;

import java.util.regex.Pattern;

/**
 * Categories of sensitive content, in the order they are checked and redacted
 */
@Getter
public enum SensitiveCategory {
    EMAIL(Pattern.compile("\\b[A-Za-z0-9._%+-]+@[A-Za-z0-9.-]+\\.[A-Za-z]{2,}\\b")),
    PHONE(Pattern.compile("\\b(\\+?1[-.\\s]?)?\\(?\\d{3}\\)?[-.\\s]?\\d{3}[-.\\s]?\\d{4}\\b")),
    NATIONAL_ID(Pattern.compile("\\b\\d{3}-\\d{2}-\\d{4}\\b")),
    PAYMENT_CARD(Pattern.compile("\\b\\d{4}[\\s-]?\\d{4}[\\s-]?\\d{4}[\\s-]?\\d{4}\\b")),
    API_KEY(Pattern.compile("\\b(sk-|pk-|api_key=|apikey=|Bearer\\s+)[A-Za-z0-9_\\-]{16,}\\b",
                            Pattern.CASE_INSENSITIVE)),
    PASSWORD(Pattern.compile("\\b(password|passwd|pwd)\\s*[:=]\\s*\\S+", Pattern.CASE_INSENSITIVE)),
    IP_ADDRESS(Pattern.compile(
            "\\b(?:(?:25[0-5]|2[0-4]\\d|[01]?\\d\\d?)\\.){3}(?:25[0-5]|2[0-4]\\d|[01]?\\d\\d?)\\b")),
    ;

    private final Pattern pattern;
    private final String replacement;

    SensitiveCategory(Pattern pattern) {
        this.pattern = pattern;
        this.replacement = "[REDACTED:" + name() + "]";
    }
}
