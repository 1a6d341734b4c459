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

package com.mnemo.core.memory;

import java.util.List;
import java.util.Optional;

/**
 * Storage boundary for long-term memory records
 */
public interface MemoryStore {
    /**
     * Find records matching the filter, most recently accessed first, then by confidence.
     *
     * @param filter Predicates and limit
     * @return Matching records, never null
     */
    List<MemoryRecord> queryRecords(MemoryFilter filter);

    /**
     * Insert a new record
     *
     * @param memoryRecord Record to insert
     * @return The stored record
     */
    MemoryRecord insertRecord(MemoryRecord memoryRecord);

    /**
     * Persist a new decay score for a record
     *
     * @param id         Record id
     * @param decayScore New score in [0, 1]
     * @return true if the record existed
     */
    boolean updateDecay(String id, double decayScore);

    /**
     * Bump the last accessed time of a record. Does not change the decay score.
     *
     * @param id Record id
     */
    void touch(String id);

    Optional<MemoryRecord> findRecord(String id);
}
