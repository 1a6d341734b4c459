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

package com.mnemo.core.errors;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 *
 */
@Getter
@AllArgsConstructor
public enum ErrorType {
    INVALID_CONFIGURATION("Invalid configuration: %s"),
    UNKNOWN_POLICY("No context policy named: %s"),
    POLICY_LOAD_FAILURE("Could not load context policies from %s. Error: %s"),
    TEXT_GENERATION_FAILURE("Text generation failed with error: %s"),
    CONSOLIDATION_FAILURE("Every step of consolidation job %s failed: %s"),
    ;

    private final String message;
}
