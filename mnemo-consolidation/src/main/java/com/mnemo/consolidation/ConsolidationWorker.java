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

package com.mnemo.consolidation;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.base.Strings;
import com.mnemo.core.conversation.ConversationTurn;
import com.mnemo.core.decay.DecayModel;
import com.mnemo.core.decay.LogisticDecayModel;
import com.mnemo.core.errors.ErrorType;
import com.mnemo.core.errors.MnemoException;
import com.mnemo.core.jobs.ConsolidationJob;
import com.mnemo.core.jobs.JobStatus;
import com.mnemo.core.jobs.JobStore;
import com.mnemo.core.jobs.MemoryDiff;
import com.mnemo.core.memory.MemoryFilter;
import com.mnemo.core.memory.MemoryKind;
import com.mnemo.core.memory.MemoryRecord;
import com.mnemo.core.memory.MemoryScope;
import com.mnemo.core.memory.MemorySource;
import com.mnemo.core.memory.MemoryStore;
import com.mnemo.core.privacy.MemoryPermissions;
import com.mnemo.core.privacy.PrivacyGate;
import com.mnemo.core.privacy.WriteDecision;
import com.mnemo.core.textgen.TextGenerator;
import com.mnemo.core.tokens.EstimatingTokenCounter;
import com.mnemo.core.tokens.TokenCounter;
import com.mnemo.core.utils.JsonUtils;
import com.mnemo.core.utils.MnemoUtils;
import com.mnemo.core.utils.VectorUtils;
import lombok.Builder;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.text.StringSubstitutor;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.function.Consumer;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Turns conversation transcripts queued by the context assembler into long-term memory. For each job it writes a
 * summary, extracts durable facts and refreshes decay of the records it can see. Every write goes through the
 * {@link PrivacyGate} first.
 * <p>
 * Text generation failures and unusable model output only skip the step they affect. A step that throws is logged
 * and recorded in {@link MemoryDiff#getStepErrors()} while the other steps still run. The job fails only when every
 * step it attempted failed.
 * Jobs are not leased, so two workers polling the same store may process the same job.
 */
@Slf4j
public class ConsolidationWorker {
    private static final String STEP_SUMMARY = "summary";
    private static final String STEP_FACTS = "facts";
    private static final String STEP_DECAY = "decay";
    private static final List<String> SUMMARY_TAGS = List.of("summary", "auto-generated");
    private static final Pattern JSON_ARRAY = Pattern.compile("\\[[\\s\\S]*]");

    private final JobStore jobStore;
    private final MemoryStore memoryStore;
    private final TextGenerator textGenerator;
    private final PrivacyGate privacyGate;
    private final DecayModel decayModel;
    private final TokenCounter tokenCounter;
    private final ConsolidationSettings settings;
    private final ConsolidationPrompts prompts;
    private final ObjectMapper mapper;
    private final Clock clock;
    private final String summarySchema;
    private final String factSchema;

    @Builder
    public ConsolidationWorker(
            @NonNull JobStore jobStore,
            @NonNull MemoryStore memoryStore,
            @NonNull TextGenerator textGenerator,
            PrivacyGate privacyGate,
            DecayModel decayModel,
            TokenCounter tokenCounter,
            ConsolidationSettings settings,
            ConsolidationPrompts prompts,
            ObjectMapper mapper,
            Clock clock) {
        this.jobStore = jobStore;
        this.memoryStore = memoryStore;
        this.textGenerator = textGenerator;
        this.privacyGate = Objects.requireNonNullElseGet(privacyGate, PrivacyGate::new);
        this.decayModel = Objects.requireNonNullElse(decayModel, LogisticDecayModel.DEFAULT);
        this.tokenCounter = Objects.requireNonNullElseGet(tokenCounter, EstimatingTokenCounter::new);
        this.settings = Objects.requireNonNullElse(settings, ConsolidationSettings.DEFAULT);
        this.prompts = Objects.requireNonNullElse(prompts, ConsolidationPrompts.DEFAULT);
        this.mapper = Objects.requireNonNullElseGet(mapper, JsonUtils::createMapper);
        this.clock = Objects.requireNonNullElseGet(clock, Clock::systemUTC);
        this.summarySchema = JsonUtils.schema(SummaryResponse.class).toString();
        this.factSchema = JsonUtils.schema(ExtractedFact.class).toString();
    }

    /**
     * Process up to one batch of pending jobs, oldest first, one after the other
     */
    public ConsolidationRunSummary processPendingJobs() {
        final var jobs = jobStore.getPendingJobs(settings.getBatchSize());
        if (jobs.isEmpty()) {
            return ConsolidationRunSummary.empty();
        }
        var processed = 0;
        var failed = 0;
        for (final var job : jobs) {
            if (processJob(job).isPresent()) {
                processed++;
            }
            else {
                failed++;
            }
        }
        log.info("Consolidation run finished. Processed: {}, failed: {}", processed, failed);
        return new ConsolidationRunSummary(processed, failed);
    }

    /**
     * Run a single job and record the outcome on it
     *
     * @param job Job to run
     * @return The diff if the job completed, empty if it failed
     */
    public Optional<MemoryDiff> processJob(@NonNull ConsolidationJob job) {
        try {
            jobStore.setJobStatus(job.getJobId(), JobStatus.PROCESSING, null, null);
            final var diff = consolidate(job);
            jobStore.setJobStatus(job.getJobId(), JobStatus.DONE, diff, null);
            log.info("Consolidation job {} done. Added: {}, updated: {}",
                     job.getJobId(), diff.getAdded(), diff.getUpdated());
            return Optional.of(diff);
        }
        catch (Exception e) {
            final var message = MnemoUtils.errorMessage(e);
            log.error("Consolidation job {} failed: {}", job.getJobId(), message, e);
            try {
                jobStore.setJobStatus(job.getJobId(), JobStatus.FAILED, null, message);
            }
            catch (Exception statusError) {
                log.error("Could not mark job {} as failed: {}",
                          job.getJobId(), MnemoUtils.errorMessage(statusError));
            }
            return Optional.empty();
        }
    }

    private MemoryDiff consolidate(ConsolidationJob job) {
        final var now = clock.instant();
        final var permissions = job.getPermissions();
        final var addedIds = new ArrayList<String>();
        final var keyFacts = new ArrayList<String>();
        final var updatedIds = new ArrayList<String>();
        final var stepErrors = new LinkedHashMap<String, String>();
        final var attempted = permissions.isCanWriteSemantic() ? 3 : 2;

        runStep(job, STEP_SUMMARY, stepErrors, () -> summarize(job, now).ifPresent(summary -> {
            addedIds.add(summary.getMemoryRecord().getId());
            keyFacts.addAll(summary.getKeyFacts());
        }));
        if (permissions.isCanWriteSemantic()) {
            runStep(job, STEP_FACTS, stepErrors,
                    () -> extractFacts(job, now, fact -> addedIds.add(fact.getId())));
        }
        else {
            log.debug("Semantic writes not allowed for job {}, skipping fact extraction", job.getJobId());
        }
        runStep(job, STEP_DECAY, stepErrors,
                () -> updatedIds.addAll(refreshDecay(job, Set.copyOf(addedIds), now)));

        if (stepErrors.size() == attempted) {
            throw new MnemoException(ErrorType.CONSOLIDATION_FAILURE, job.getJobId(), stepErrors);
        }
        return MemoryDiff.builder()
                .added(addedIds.size())
                .updated(updatedIds.size())
                .removed(0)
                .addedIds(List.copyOf(addedIds))
                .updatedIds(List.copyOf(updatedIds))
                .keyFacts(List.copyOf(keyFacts))
                .stepErrors(Map.copyOf(stepErrors))
                .build();
    }

    private static void runStep(ConsolidationJob job, String step, Map<String, String> stepErrors, Runnable action) {
        try {
            action.run();
        }
        catch (Exception e) {
            final var message = MnemoUtils.errorMessage(e);
            log.error("Step {} of consolidation job {} failed, continuing with the rest: {}",
                      step, job.getJobId(), message, e);
            stepErrors.put(step, message);
        }
    }

    private Optional<StoredSummary> summarize(ConsolidationJob job, Instant now) {
        final var permissions = job.getPermissions();
        if (!permissions.isCanWriteSummary()) {
            log.debug("Summary writes not allowed for job {}", job.getJobId());
            return Optional.empty();
        }
        if (job.getTranscript().size() < settings.getMinTurnsForSummary()) {
            log.debug("Transcript of job {} has {} turns, too short to summarise",
                      job.getJobId(), job.getTranscript().size());
            return Optional.empty();
        }
        final var output = generate(prompts.getSummaryPrompt(),
                                    Map.of("transcript", transcriptText(job.getTranscript(),
                                                                        settings.getSummaryTranscriptChars()),
                                           "maxFacts", settings.getMaxKeyFacts(),
                                           "schema", summarySchema));
        if (Strings.isNullOrEmpty(output)) {
            return Optional.empty();
        }
        final var response = parseSummary(output);
        final var content = gate(response.getSummary(), MemoryKind.SUMMARY, permissions);
        if (content == null) {
            log.info("Summary for job {} blocked by privacy gate", job.getJobId());
            return Optional.empty();
        }
        final var stored = memoryStore.insertRecord(MemoryRecord.builder()
                                                            .id(UUID.randomUUID().toString())
                                                            .kind(MemoryKind.SUMMARY)
                                                            .scope(MemoryScope.CONVERSATION)
                                                            .content(content)
                                                            .tags(SUMMARY_TAGS)
                                                            .confidence(settings.getSummaryConfidence())
                                                            .decayScore(0)
                                                            .tokenCount(tokenCounter.count(content))
                                                            .userId(job.getUserId())
                                                            .sessionId(job.getConversationId())
                                                            .projectId(job.getProjectId())
                                                            .source(MemorySource.CONSOLIDATION)
                                                            .createdAt(now)
                                                            .lastAccessedAt(now)
                                                            .build());
        final var facts = response.getKeyFacts()
                .stream()
                .filter(fact -> !Strings.isNullOrEmpty(fact))
                .limit(settings.getMaxKeyFacts())
                .map(fact -> Objects.requireNonNullElse(gate(fact, MemoryKind.SUMMARY, permissions), ""))
                .filter(fact -> !fact.isEmpty())
                .toList();
        return Optional.of(new StoredSummary(stored, facts));
    }

    private void extractFacts(ConsolidationJob job, Instant now, Consumer<MemoryRecord> onStored) {
        final var output = generate(prompts.getFactPrompt(),
                                    Map.of("transcript", transcriptText(job.getTranscript(),
                                                                        settings.getFactTranscriptChars()),
                                           "maxFacts", settings.getMaxSemanticFacts(),
                                           "schema", factSchema));
        if (Strings.isNullOrEmpty(output)) {
            return;
        }
        var stored = 0;
        for (final var fact : parseFacts(output)) {
            if (fact.getContent() == null || fact.getContent().isBlank()) {
                continue;
            }
            final var content = gate(fact.getContent().trim(), MemoryKind.SEMANTIC, job.getPermissions());
            if (content == null) {
                log.debug("Fact from job {} blocked by privacy gate", job.getJobId());
                continue;
            }
            onStored.accept(memoryStore.insertRecord(MemoryRecord.builder()
                                                        .id(UUID.randomUUID().toString())
                                                        .kind(MemoryKind.SEMANTIC)
                                                        .scope(factScope(fact.getScope()))
                                                        .content(content)
                                                        .tags(Objects.requireNonNullElseGet(fact.getTags(), List::of))
                                                        .confidence(VectorUtils.clamp(
                                                                Objects.requireNonNullElse(
                                                                        fact.getConfidence(),
                                                                        settings.getDefaultFactConfidence()),
                                                                0, 1))
                                                        .decayScore(0)
                                                        .tokenCount(tokenCounter.count(content))
                                                        .userId(job.getUserId())
                                                        .sessionId(job.getConversationId())
                                                        .projectId(job.getProjectId())
                                                        .source(MemorySource.CONSOLIDATION)
                                                        .createdAt(now)
                                                        .lastAccessedAt(now)
                                                        .build()));
            stored++;
        }
        log.debug("Stored {} facts for job {}", stored, job.getJobId());
    }

    private List<String> refreshDecay(ConsolidationJob job, Set<String> addedIds, Instant now) {
        final var records = memoryStore.queryRecords(MemoryFilter.builder()
                                                             .userId(job.getUserId())
                                                             .sessionId(job.getConversationId())
                                                             .projectId(job.getProjectId())
                                                             .excludeStale(false)
                                                             .limit(settings.getDecayRefreshLimit())
                                                             .build());
        final var updated = new ArrayList<String>();
        for (final var memoryRecord : records) {
            if (addedIds.contains(memoryRecord.getId()) || memoryRecord.getLastAccessedAt() == null) {
                continue;
            }
            final var decay = decayModel.decay(memoryRecord.getLastAccessedAt(), now);
            if (Math.abs(decay - memoryRecord.getDecayScore()) > settings.getDecayRefreshDelta()
                    && memoryStore.updateDecay(memoryRecord.getId(), decay)) {
                updated.add(memoryRecord.getId());
            }
        }
        return updated;
    }

    private String generate(String template, Map<String, Object> values) {
        final var prompt = StringSubstitutor.replace(template, values);
        try {
            final var output = textGenerator.generate(prompt, settings.getMaxGenerationTokens());
            if (Strings.isNullOrEmpty(output) || output.isBlank()) {
                log.warn("Text generator returned nothing, skipping step");
                return null;
            }
            return output;
        }
        catch (Exception e) {
            log.warn("Text generation failed, skipping step: {}", MnemoUtils.errorMessage(e));
            return null;
        }
    }

    private SummaryResponse parseSummary(String output) {
        final var body = JsonUtils.stripCodeFences(output);
        try {
            final var response = mapper.readValue(body, SummaryResponse.class);
            if (!Strings.isNullOrEmpty(response.getSummary()) && !response.getSummary().isBlank()) {
                return response.getKeyFacts() == null
                       ? SummaryResponse.builder().summary(response.getSummary()).build()
                       : response;
            }
            log.warn("Summary reply carried no summary, using raw text");
        }
        catch (Exception e) {
            log.warn("Could not parse summary reply, using raw text: {}", MnemoUtils.errorMessage(e));
        }
        return SummaryResponse.builder().summary(body).build();
    }

    private List<ExtractedFact> parseFacts(String output) {
        final var matcher = JSON_ARRAY.matcher(JsonUtils.stripCodeFences(output));
        if (!matcher.find()) {
            log.warn("Fact extraction reply carried no JSON array");
            return List.of();
        }
        try {
            final List<ExtractedFact> facts = mapper.readValue(matcher.group(), new TypeReference<>() {
            });
            return facts.stream()
                    .filter(Objects::nonNull)
                    .limit(settings.getMaxSemanticFacts())
                    .toList();
        }
        catch (Exception e) {
            log.warn("Could not parse fact extraction reply: {}", MnemoUtils.errorMessage(e));
            return List.of();
        }
    }

    /**
     * @return Content to write, redacted where needed, or null if the write is blocked
     */
    private String gate(String content, MemoryKind kind, MemoryPermissions permissions) {
        final var decision = privacyGate.classifyWrite(content, kind, permissions);
        if (decision == WriteDecision.BLOCK) {
            return null;
        }
        return decision == WriteDecision.REDACT_THEN_STORE ? privacyGate.redact(content) : content;
    }

    private String transcriptText(List<ConversationTurn> transcript, int maxChars) {
        final var text = transcript.stream()
                .map(turn -> turn.getRole().name() + ": " + privacyGate.redact(turn.getContent()))
                .collect(Collectors.joining("\n"));
        return text.length() <= maxChars ? text : text.substring(0, maxChars);
    }

    private static MemoryScope factScope(String scope) {
        if (Strings.isNullOrEmpty(scope)) {
            return MemoryScope.PROJECT;
        }
        try {
            return MemoryScope.valueOf(scope.trim().toUpperCase(Locale.ROOT));
        }
        catch (IllegalArgumentException e) {
            log.debug("Unknown fact scope '{}', using project", scope);
            return MemoryScope.PROJECT;
        }
    }

    @lombok.Value
    private static class StoredSummary {
        MemoryRecord memoryRecord;
        List<String> keyFacts;
    }
}
