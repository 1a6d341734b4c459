package com.mnemo.consolidation;

import com.fasterxml.jackson.annotation.JsonPropertyDescription;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * A durable fact proposed by the extraction prompt
 */
@Value
@Builder
@Jacksonized
public class ExtractedFact {
    @JsonPropertyDescription("The fact, phrased so that it makes sense without the conversation")
    String content;

    @JsonPropertyDescription("One to three relevant keywords")
    List<String> tags;

    @JsonPropertyDescription("How certain and durable the fact is, between 0.5 and 1.0")
    Double confidence;

    @JsonPropertyDescription("One of conversation, project or global. Defaults to project.")
    String scope;
}
