package com.mnemo.consolidation;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;
import lombok.With;

/**
 * Prompt templates used by the consolidation worker. Placeholders are resolved with
 * {@link org.apache.commons.text.StringSubstitutor}: {@code ${transcript}}, {@code ${maxFacts}} and
 * {@code ${schema}}.
 */
@Value
@Builder
@With
@AllArgsConstructor(access = AccessLevel.PUBLIC)
public class ConsolidationPrompts {
    public static final String DEFAULT_SUMMARY_PROMPT = """
            Summarize this conversation in 3-5 concise bullet points.
            Focus on: key decisions made, important facts mentioned, user preferences revealed, unresolved questions.
            Be specific, not generic. Also list between 3 and ${maxFacts} key facts.

            Reply with a single JSON object matching this schema and nothing else:
            ${schema}

            <conversation>
            ${transcript}
            </conversation>""";

    public static final String DEFAULT_FACT_PROMPT = """
            Extract durable facts and preferences from this conversation.
            Return ONLY a JSON array whose items match this schema:
            ${schema}

            Rules:
            - Only include facts likely to remain true across sessions
            - Tags should be 1-3 relevant keywords
            - Confidence: 0.5-1.0 (how certain/durable this fact is)
            - Max ${maxFacts} items
            - Return an empty array [] if nothing durable was found

            <conversation>
            ${transcript}
            </conversation>

            JSON:""";

    public static final ConsolidationPrompts DEFAULT = new ConsolidationPrompts(DEFAULT_SUMMARY_PROMPT,
                                                                                DEFAULT_FACT_PROMPT);

    @Builder.Default
    String summaryPrompt = DEFAULT_SUMMARY_PROMPT;

    @Builder.Default
    String factPrompt = DEFAULT_FACT_PROMPT;
}
