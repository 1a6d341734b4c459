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

package com.mnemo.storage.inmemory;

import com.mnemo.core.memory.MemoryFilter;
import com.mnemo.core.memory.MemoryRecord;
import com.mnemo.core.memory.MemoryStore;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Memory store backed by a map. Useful for tests and single process deployments.
 */
@Slf4j
public class InMemoryMemoryStore implements MemoryStore {
    private static final Comparator<MemoryRecord> RECENT_FIRST = Comparator
            .comparing(MemoryRecord::getLastAccessedAt, Comparator.nullsLast(Comparator.reverseOrder()))
            .thenComparing(MemoryRecord::getConfidence, Comparator.reverseOrder())
            .thenComparing(MemoryRecord::getId);

    private final Map<String, MemoryRecord> records = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryMemoryStore() {
        this(Clock.systemUTC());
    }

    public InMemoryMemoryStore(@NonNull Clock clock) {
        this.clock = clock;
    }

    @Override
    public List<MemoryRecord> queryRecords(@NonNull MemoryFilter filter) {
        return records.values()
                .stream()
                .filter(filter::admits)
                .sorted(RECENT_FIRST)
                .limit(Math.max(0, filter.getLimit()))
                .toList();
    }

    @Override
    public MemoryRecord insertRecord(@NonNull MemoryRecord memoryRecord) {
        final var now = clock.instant();
        final var toSave = memoryRecord
                .withCreatedAt(Objects.requireNonNullElse(memoryRecord.getCreatedAt(), now))
                .withLastAccessedAt(Objects.requireNonNullElse(memoryRecord.getLastAccessedAt(), now));
        records.put(toSave.getId(), toSave);
        log.debug("Stored {} memory {} in scope {}", toSave.getKind(), toSave.getId(), toSave.getScope());
        return toSave;
    }

    @Override
    public boolean updateDecay(String id, double decayScore) {
        return records.computeIfPresent(id, (key, existing) -> existing.withDecayScore(decayScore)) != null;
    }

    @Override
    public void touch(String id) {
        final Instant now = clock.instant();
        records.computeIfPresent(id, (key, existing) -> existing.withLastAccessedAt(now));
    }

    @Override
    public Optional<MemoryRecord> findRecord(String id) {
        return Optional.ofNullable(records.get(id));
    }

    public int size() {
        return records.size();
    }
}
