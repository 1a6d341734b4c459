package com.mnemo.consolidation;

import com.fasterxml.jackson.annotation.JsonClassDescription;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyDescription;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Reply expected from the summarisation prompt
 */
@Value
@Builder
@Jacksonized
@JsonClassDescription("Summary of a conversation")
public class SummaryResponse {
    @JsonPropertyDescription("Three to five concise bullet points covering decisions, facts, preferences and open questions")
    String summary;

    @JsonProperty("key_facts")
    @JsonPropertyDescription("Between three and seven short factual statements from the conversation")
    @Builder.Default
    List<String> keyFacts = List.of();
}
