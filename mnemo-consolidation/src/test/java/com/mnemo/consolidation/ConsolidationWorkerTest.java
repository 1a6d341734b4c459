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

import com.mnemo.core.conversation.ConversationTurn;
import com.mnemo.core.conversation.TurnRole;
import com.mnemo.core.jobs.ConsolidationJob;
import com.mnemo.core.jobs.JobStatus;
import com.mnemo.core.jobs.TriggerReason;
import com.mnemo.core.memory.MemoryKind;
import com.mnemo.core.memory.MemoryRecord;
import com.mnemo.core.memory.MemoryScope;
import com.mnemo.core.memory.MemorySource;
import com.mnemo.core.memory.MemoryStore;
import com.mnemo.core.privacy.MemoryPermissions;
import com.mnemo.core.textgen.TextGenerator;
import com.mnemo.storage.inmemory.InMemoryJobStore;
import com.mnemo.storage.inmemory.InMemoryMemoryStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.startsWith;
import static org.mockito.Mockito.*;

class ConsolidationWorkerTest {
    private static final Instant NOW = Instant.parse("2025-04-01T09:00:00Z");

    private static final String SUMMARY_REPLY = """
            Here you go:
            ```json
            {
              "summary": "- User prefers Maven over Gradle\\n- CI runs on JDK 17",
              "key_facts": ["f1", "f2", "f3", "f4", "f5", "f6", "f7", "f8", "f9"]
            }
            ```""";

    private static final String FACTS_REPLY = """
            [
              {"content": "User prefers Maven over Gradle", "tags": ["build"], "confidence": 0.9},
              {"content": "Team lead is reachable at jane@example.com", "tags": ["contact"]},
              {"content": "CI runs on JDK 17", "tags": ["ci"], "confidence": 3.0, "scope": "global"},
              {"content": "Releases happen on Fridays", "scope": "nonsense"},
              {"content": "Repository uses trunk based development", "confidence": 0.6},
              {"content": "This sixth fact is over the limit"}
            ]""";

    private InMemoryMemoryStore memoryStore;
    private InMemoryJobStore jobStore;
    private TextGenerator textGenerator;
    private ConsolidationWorker worker;

    @BeforeEach
    void setUp() {
        final var clock = Clock.fixed(NOW, ZoneOffset.UTC);
        memoryStore = new InMemoryMemoryStore(clock);
        jobStore = new InMemoryJobStore();
        textGenerator = mock(TextGenerator.class);
        worker = ConsolidationWorker.builder()
                .jobStore(jobStore)
                .memoryStore(memoryStore)
                .textGenerator(textGenerator)
                .clock(clock)
                .build();
    }

    @Test
    void writesSummaryAndFacts() {
        when(textGenerator.generate(anyString(), anyInt()))
                .thenAnswer(invocation -> invocation.getArgument(0, String.class).startsWith("Summarize")
                                          ? SUMMARY_REPLY
                                          : FACTS_REPLY);
        final var job = jobStore.enqueue(job(4, MemoryPermissions.ALLOW_ALL));

        final var diff = worker.processJob(job).orElseThrow();

        assertEquals(6, diff.getAdded());
        assertEquals(0, diff.getRemoved());
        assertEquals(List.of("f1", "f2", "f3", "f4", "f5", "f6", "f7"), diff.getKeyFacts());
        final var stored = jobStore.findJob(job.getJobId()).orElseThrow();
        assertEquals(JobStatus.DONE, stored.getStatus());
        assertEquals(diff, stored.getResult());

        final var summary = memoryStore.findRecord(diff.getAddedIds().get(0)).orElseThrow();
        assertEquals(MemoryKind.SUMMARY, summary.getKind());
        assertEquals(MemoryScope.CONVERSATION, summary.getScope());
        assertEquals(List.of("summary", "auto-generated"), summary.getTags());
        assertEquals(0.9, summary.getConfidence(), 1e-9);
        assertEquals(0.0, summary.getDecayScore(), 1e-9);
        assertEquals(MemorySource.CONSOLIDATION, summary.getSource());
        assertEquals("s1", summary.getSessionId());
        assertTrue(summary.getContent().startsWith("- User prefers Maven"));

        final var facts = diff.getAddedIds()
                .subList(1, 6)
                .stream()
                .map(id -> memoryStore.findRecord(id).orElseThrow())
                .toList();
        assertTrue(facts.stream().allMatch(fact -> fact.getKind() == MemoryKind.SEMANTIC));
        assertEquals("Team lead is reachable at [REDACTED:EMAIL]", facts.get(1).getContent());
        assertEquals(0.7, facts.get(1).getConfidence(), 1e-9);
        assertEquals(MemoryScope.PROJECT, facts.get(1).getScope());
        assertEquals(1.0, facts.get(2).getConfidence(), 1e-9);
        assertEquals(MemoryScope.GLOBAL, facts.get(2).getScope());
        assertEquals(MemoryScope.PROJECT, facts.get(3).getScope());
        assertTrue(facts.stream().noneMatch(fact -> fact.getContent().contains("sixth")));
    }

    @Test
    void transcriptIsRedactedBeforeGeneration() {
        final var prompts = ArgumentCaptor.forClass(String.class);
        when(textGenerator.generate(prompts.capture(), anyInt())).thenReturn(null);
        final var turns = new ArrayList<>(turns(3));
        turns.add(turn(4, "my email is bob@example.org"));
        jobStore.enqueue(ConsolidationJob.pending("s1", "u1", "p1", TriggerReason.SESSION_END, turns,
                                                  MemoryPermissions.ALLOW_ALL, NOW));

        assertEquals(1, worker.processPendingJobs().getProcessed());
        assertEquals(2, prompts.getAllValues().size());
        prompts.getAllValues().forEach(prompt -> {
            assertFalse(prompt.contains("bob@example.org"));
            assertTrue(prompt.contains("USER: my email is [REDACTED:EMAIL]"));
        });
    }

    @Test
    void unparseableSummaryFallsBackToRawText() {
        when(textGenerator.generate(startsWith("Summarize"), anyInt())).thenReturn("The user likes green tea.");
        when(textGenerator.generate(startsWith("Extract"), anyInt())).thenReturn("Nothing durable here.");
        final var job = jobStore.enqueue(job(5, MemoryPermissions.ALLOW_ALL));

        final var diff = worker.processJob(job).orElseThrow();

        assertEquals(1, diff.getAdded());
        assertTrue(diff.getKeyFacts().isEmpty());
        assertEquals("The user likes green tea.",
                     memoryStore.findRecord(diff.getAddedIds().get(0)).orElseThrow().getContent());
    }

    @Test
    void generationFailureOnlySkipsTheStep() {
        when(textGenerator.generate(anyString(), anyInt())).thenThrow(new IllegalStateException("model down"));
        final var job = jobStore.enqueue(job(4, MemoryPermissions.ALLOW_ALL));

        final var diff = worker.processJob(job).orElseThrow();

        assertEquals(0, diff.getAdded());
        assertEquals(JobStatus.DONE, jobStore.findJob(job.getJobId()).orElseThrow().getStatus());
        assertEquals(0, memoryStore.size());
    }

    @Test
    void shortTranscriptIsNotSummarised() {
        when(textGenerator.generate(anyString(), anyInt())).thenReturn("[]");
        final var job = jobStore.enqueue(job(2, MemoryPermissions.ALLOW_ALL));

        worker.processJob(job).orElseThrow();

        verify(textGenerator, never()).generate(startsWith("Summarize"), anyInt());
        verify(textGenerator).generate(startsWith("Extract"), eq(1024));
    }

    @Test
    void forbiddenWritesSkipGeneration() {
        final var job = jobStore.enqueue(job(6, MemoryPermissions.builder().build()));

        final var diff = worker.processJob(job).orElseThrow();

        assertEquals(0, diff.getAdded());
        verifyNoInteractions(textGenerator);
    }

    @Test
    void refreshesDecayOnlyWhenItMovedEnough() {
        memoryStore.insertRecord(existing("stale", NOW.minus(Duration.ofHours(200)), 0.0));
        memoryStore.insertRecord(existing("fresh", NOW.minus(Duration.ofHours(1)), 0.19));
        memoryStore.insertRecord(existing("other-user", NOW.minus(Duration.ofHours(200)), 0.0)
                                         .withUserId("u2"));
        final var job = jobStore.enqueue(job(1, MemoryPermissions.builder().build()));

        final var diff = worker.processJob(job).orElseThrow();

        assertEquals(List.of("stale"), diff.getUpdatedIds());
        assertEquals(1, diff.getUpdated());
        assertEquals(0.95, memoryStore.findRecord("stale").orElseThrow().getDecayScore(), 1e-9);
        assertEquals(0.19, memoryStore.findRecord("fresh").orElseThrow().getDecayScore(), 1e-9);
        assertEquals(0.0, memoryStore.findRecord("other-user").orElseThrow().getDecayScore(), 1e-9);
    }

    @Test
    void failedWritesDoNotStopDecayRefresh() {
        final var flakyStore = spy(new InMemoryMemoryStore(Clock.fixed(NOW, ZoneOffset.UTC)));
        flakyStore.insertRecord(existing("week-old", NOW.minus(Duration.ofDays(7)), 0.0));
        doThrow(new IllegalStateException("disk full")).when(flakyStore).insertRecord(any());
        when(textGenerator.generate(anyString(), anyInt()))
                .thenAnswer(invocation -> invocation.getArgument(0, String.class).startsWith("Summarize")
                                          ? SUMMARY_REPLY
                                          : FACTS_REPLY);
        final var flakyWorker = ConsolidationWorker.builder()
                .jobStore(jobStore)
                .memoryStore(flakyStore)
                .textGenerator(textGenerator)
                .clock(Clock.fixed(NOW, ZoneOffset.UTC))
                .build();
        final var job = jobStore.enqueue(job(4, MemoryPermissions.ALLOW_ALL));

        final var diff = flakyWorker.processJob(job).orElseThrow();

        assertEquals(0, diff.getAdded());
        assertEquals(List.of("week-old"), diff.getUpdatedIds());
        assertEquals(0.95, flakyStore.findRecord("week-old").orElseThrow().getDecayScore(), 1e-9);
        assertEquals(Map.of("summary", "disk full", "facts", "disk full"), diff.getStepErrors());
        verify(textGenerator, times(2)).generate(anyString(), anyInt());
        assertEquals(JobStatus.DONE, jobStore.findJob(job.getJobId()).orElseThrow().getStatus());
    }

    @Test
    void jobFailsWhenEveryStepFails() {
        final var brokenStore = mock(MemoryStore.class);
        when(brokenStore.insertRecord(any())).thenThrow(new IllegalStateException("disk full"));
        when(brokenStore.queryRecords(any())).thenThrow(new IllegalStateException("disk full"));
        when(textGenerator.generate(anyString(), anyInt())).thenReturn(SUMMARY_REPLY);
        final var brokenWorker = ConsolidationWorker.builder()
                .jobStore(jobStore)
                .memoryStore(brokenStore)
                .textGenerator(textGenerator)
                .build();
        final var job = jobStore.enqueue(job(4, MemoryPermissions.builder().canWriteSummary(true).build()));

        assertTrue(brokenWorker.processJob(job).isEmpty());

        final var stored = jobStore.findJob(job.getJobId()).orElseThrow();
        assertEquals(JobStatus.FAILED, stored.getStatus());
        assertTrue(stored.getError().contains("disk full"));
        assertNull(stored.getResult());
    }

    @Test
    void processesOneBatchPerRun() {
        when(textGenerator.generate(anyString(), anyInt())).thenReturn(null);
        IntStream.range(0, 7).forEach(i -> jobStore.enqueue(job(1, MemoryPermissions.ALLOW_ALL)));

        final var run = worker.processPendingJobs();

        assertEquals(5, run.getProcessed());
        assertEquals(0, run.getFailed());
        assertEquals(2, jobStore.getPendingJobs(10).size());
        assertEquals(2, worker.processPendingJobs().getProcessed());
        assertEquals(ConsolidationRunSummary.empty(), worker.processPendingJobs());
    }

    private static ConsolidationJob job(int turnCount, MemoryPermissions permissions) {
        return ConsolidationJob.pending("s1", "u1", "p1", TriggerReason.TOKEN_PRESSURE,
                                        turns(turnCount), permissions, NOW);
    }

    private static List<ConversationTurn> turns(int count) {
        return IntStream.range(0, count)
                .mapToObj(i -> turn(i, "We talked about build tooling, part " + i))
                .toList();
    }

    private static ConversationTurn turn(int index, String content) {
        return ConversationTurn.builder()
                .messageId("m" + index)
                .role(index % 2 == 0 ? TurnRole.USER : TurnRole.ASSISTANT)
                .content(content)
                .tokenCount(content.length() / 4)
                .timestamp(NOW.minusSeconds(60L * (10 - index)))
                .build();
    }

    private static MemoryRecord existing(String id, Instant lastAccessedAt, double decay) {
        return MemoryRecord.builder()
                .id(id)
                .kind(MemoryKind.EPISODIC)
                .scope(MemoryScope.CONVERSATION)
                .content("existing " + id)
                .userId("u1")
                .sessionId("s1")
                .decayScore(decay)
                .createdAt(lastAccessedAt)
                .lastAccessedAt(lastAccessedAt)
                .build();
    }
}
