package com.mnemo.models;

import lombok.Builder;
import lombok.Value;
import lombok.With;

/**
 * Request level settings for {@link SimpleOpenAITextGenerator}. Unset values are left to the provider.
 */
@Value
@Builder
@With
public class SimpleOpenAITextGeneratorOptions {
    public static final SimpleOpenAITextGeneratorOptions DEFAULT = SimpleOpenAITextGeneratorOptions.builder().build();

    /**
     * Sent as a system message ahead of the prompt when set
     */
    String systemPrompt;

    Double temperature;

    Integer seed;
}
