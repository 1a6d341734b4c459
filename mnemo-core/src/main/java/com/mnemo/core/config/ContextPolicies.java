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

package com.mnemo.core.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mnemo.core.errors.ErrorType;
import com.mnemo.core.errors.MnemoException;
import com.mnemo.core.utils.JsonUtils;
import com.mnemo.core.utils.MnemoUtils;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Named context policies loaded from JSON. Every policy is validated at load time.
 */
@Slf4j
public class ContextPolicies {
    public static final String DEFAULT_RESOURCE = "mnemo-policies.json";
    public static final String DEFAULT_POLICY = "default";

    @Value
    @Builder
    @Jacksonized
    public static class PolicyFile {
        @Builder.Default
        List<ContextPolicy> policies = List.of();
    }

    private final Map<String, ContextPolicy> policies;

    public ContextPolicies(@NonNull List<ContextPolicy> policies) {
        final var byId = new LinkedHashMap<String, ContextPolicy>();
        for (final var policy : policies) {
            final var existing = byId.put(policy.validate().getId(), policy);
            if (existing != null) {
                throw new MnemoException(ErrorType.INVALID_CONFIGURATION,
                                         "duplicate policy id '%s'".formatted(policy.getId()));
            }
        }
        if (byId.isEmpty()) {
            throw new MnemoException(ErrorType.INVALID_CONFIGURATION, "no policies defined");
        }
        this.policies = Collections.unmodifiableMap(byId);
    }

    /**
     * Load the bundled default, fast and deep presets
     */
    public static ContextPolicies defaults() {
        return fromResource(DEFAULT_RESOURCE);
    }

    public static ContextPolicies fromResource(String resource) {
        return fromResource(resource, JsonUtils.createMapper());
    }

    public static ContextPolicies fromResource(@NonNull String resource, @NonNull ObjectMapper mapper) {
        final var classLoader = ContextPolicies.class.getClassLoader();
        try (final var in = classLoader.getResourceAsStream(resource)) {
            if (in == null) {
                throw new MnemoException(ErrorType.POLICY_LOAD_FAILURE, resource, "resource not found");
            }
            final var file = mapper.readValue(in, PolicyFile.class);
            final var loaded = new ContextPolicies(file.getPolicies());
            log.debug("Loaded {} context policies from {}", loaded.policies.size(), resource);
            return loaded;
        }
        catch (IOException e) {
            throw new MnemoException(e, ErrorType.POLICY_LOAD_FAILURE, resource, MnemoUtils.errorMessage(e));
        }
    }

    public ContextPolicy get(@NonNull String id) {
        final var policy = policies.get(id);
        if (policy == null) {
            throw new MnemoException(ErrorType.UNKNOWN_POLICY, id);
        }
        return policy;
    }

    /**
     * Named policy with project overrides applied
     */
    public ContextPolicy get(@NonNull String id, PolicyOverrides overrides) {
        final var base = get(id);
        return overrides == null ? base : overrides.applyTo(base);
    }

    public ContextPolicy defaultPolicy() {
        return get(DEFAULT_POLICY);
    }

    public Set<String> ids() {
        return policies.keySet();
    }
}
