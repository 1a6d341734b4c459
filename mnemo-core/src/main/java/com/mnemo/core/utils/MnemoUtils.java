package com.mnemo.core.utils;

import com.google.common.base.Strings;
import lombok.experimental.UtilityClass;

/**
 * Small helpers shared across modules
 */
@UtilityClass
public class MnemoUtils {
    private static final String ELLIPSIS = "...";

    public static Throwable rootCause(final Throwable leaf) {
        Throwable cause = leaf;
        while (cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause;
    }

    public static String errorMessage(final Throwable t) {
        final var root = rootCause(t);
        return Strings.isNullOrEmpty(root.getMessage())
               ? root.getClass().getSimpleName()
               : root.getMessage();
    }

    /**
     * At most {@code maxChars} characters of the text, ending with an ellipsis when cut
     */
    public static String excerpt(String text, int maxChars) {
        if (Strings.isNullOrEmpty(text) || text.length() <= maxChars) {
            return Strings.nullToEmpty(text);
        }
        if (maxChars <= ELLIPSIS.length()) {
            return text.substring(0, Math.max(0, maxChars));
        }
        return text.substring(0, maxChars - ELLIPSIS.length()) + ELLIPSIS;
    }
}
