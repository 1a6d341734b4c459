package com.mnemo.core.tokens;

import com.google.common.base.Strings;
import com.knuddels.jtokkit.Encodings;
import com.knuddels.jtokkit.api.Encoding;
import com.knuddels.jtokkit.api.EncodingType;

/**
 * Token counter backed by a BPE encoding. Defaults to cl100k_base.
 */
public class JTokkitTokenCounter implements TokenCounter {
    private final Encoding encoding;

    public JTokkitTokenCounter() {
        this(EncodingType.CL100K_BASE);
    }

    public JTokkitTokenCounter(EncodingType encodingType) {
        this.encoding = Encodings.newDefaultEncodingRegistry().getEncoding(encodingType);
    }

    @Override
    public int count(String text) {
        if (Strings.isNullOrEmpty(text)) {
            return 0;
        }
        return encoding.countTokensOrdinary(text);
    }
}
