/*
 * Copyright (c) 2025 Original Author(s), PhonePe India Pvt. Ltd.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.mnemo.core.privacy;

import com.google.common.base.Strings;
import com.mnemo.core.memory.MemoryKind;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Decides what may be remembered about a piece of text and scrubs sensitive content out of anything shown or stored.
 * Detection is best effort.
 */
@Slf4j
public class PrivacyGate {
    private final ForgetDirectiveDetector forgetDirectiveDetector;
    private final SentimentClassifier sentimentClassifier;

    public PrivacyGate() {
        this(new ForgetDirectiveDetector(), new SentimentClassifier());
    }

    public PrivacyGate(
            @NonNull ForgetDirectiveDetector forgetDirectiveDetector,
            @NonNull SentimentClassifier sentimentClassifier) {
        this.forgetDirectiveDetector = forgetDirectiveDetector;
        this.sentimentClassifier = sentimentClassifier;
    }

    /**
     * Sensitive categories present in the text, in detection order
     */
    public Set<SensitiveCategory> detect(String text) {
        if (Strings.isNullOrEmpty(text)) {
            return Set.of();
        }
        final var found = EnumSet.noneOf(SensitiveCategory.class);
        for (final var category : SensitiveCategory.values()) {
            if (category.getPattern().matcher(text).find()) {
                found.add(category);
            }
        }
        return Collections.unmodifiableSet(found);
    }

    /**
     * Replace every sensitive match with a category tag. Applying this twice gives the same result as once.
     */
    public String redact(String text) {
        if (Strings.isNullOrEmpty(text)) {
            return text;
        }
        var result = text;
        for (final var category : SensitiveCategory.values()) {
            result = category.getPattern().matcher(result).replaceAll(category.getReplacement());
        }
        return result;
    }

    public SentimentResult classifySentiment(String text) {
        return sentimentClassifier.classify(text);
    }

    public MemoryPermissions analyze(String text) {
        return analyze(text, PrivacyMode.STANDARD);
    }

    /**
     * Derive write permissions for a message
     *
     * @param text Message text
     * @param mode Privacy mode in effect
     * @return Permissions along with the signals behind them
     */
    public MemoryPermissions analyze(String text, @NonNull PrivacyMode mode) {
        final var categories = detect(text);
        final var sentiment = sentimentClassifier.classify(text);
        final var directive = forgetDirectiveDetector.findDirective(text);
        final var builder = MemoryPermissions.builder()
                .sentiment(sentiment)
                .detectedCategories(categories)
                .privacyMode(mode);
        if (directive.isPresent()) {
            log.debug("Forget directive '{}' found, all memory writes disabled", directive.get());
            return builder
                    .canWriteEpisodic(false)
                    .canWriteSemantic(false)
                    .canWriteSummary(false)
                    .retentionOverride(RetentionOverride.forget(directive.get()))
                    .build();
        }
        final var sensitive = !categories.isEmpty();
        final var episodic = switch (mode) {
            case STANDARD -> !sensitive;
            case STRICT -> !sensitive && sentiment.getLabel() != SentimentLabel.VOLATILE;
            case PERMISSIVE -> true;
        };
        return builder
                .canWriteEpisodic(episodic)
                .canWriteSemantic(true)
                .canWriteSummary(true)
                .build();
    }

    /**
     * Gate a single write of the given kind
     *
     * @param content     Content about to be written
     * @param kind        Kind of record
     * @param permissions Permissions of the conversation the content came from
     * @return Whether to store as-is, redact first, or drop
     */
    public WriteDecision classifyWrite(String content, @NonNull MemoryKind kind, @NonNull MemoryPermissions permissions) {
        if (!isPermitted(kind, permissions)) {
            return WriteDecision.BLOCK;
        }
        if (detect(content).isEmpty()) {
            return WriteDecision.STORE;
        }
        return permissions.getPrivacyMode() == PrivacyMode.STRICT
               ? WriteDecision.BLOCK
               : WriteDecision.REDACT_THEN_STORE;
    }

    private static boolean isPermitted(MemoryKind kind, MemoryPermissions permissions) {
        return switch (kind) {
            case EPISODIC -> permissions.isCanWriteEpisodic();
            case SEMANTIC -> permissions.isCanWriteSemantic();
            case SUMMARY -> permissions.isCanWriteSummary();
        };
    }
}
