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

package com.mnemo.models;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.base.Strings;
import com.mnemo.core.errors.ErrorType;
import com.mnemo.core.errors.MnemoException;
import com.mnemo.core.textgen.TextGenerator;
import com.mnemo.core.utils.JsonUtils;
import com.mnemo.core.utils.MnemoUtils;
import io.github.sashirestela.openai.domain.chat.Chat;
import io.github.sashirestela.openai.domain.chat.ChatMessage;
import io.github.sashirestela.openai.domain.chat.ChatRequest;
import io.github.sashirestela.openai.service.ChatCompletionServices;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Objects;

/**
 * {@link TextGenerator} over any OpenAI compatible chat completions endpoint, via simple-openai.
 * Returns null when the model replies without text. Transport and API errors are raised as
 * {@link MnemoException} with {@link ErrorType#TEXT_GENERATION_FAILURE}.
 */
@Slf4j
public class SimpleOpenAITextGenerator implements TextGenerator {
    private final String modelName;
    private final ChatCompletionServices chatCompletionServices;
    private final SimpleOpenAITextGeneratorOptions options;
    private final ObjectMapper mapper;

    public SimpleOpenAITextGenerator(
            @NonNull String modelName,
            @NonNull ChatCompletionServices chatCompletionServices) {
        this(modelName, chatCompletionServices, null, null);
    }

    public SimpleOpenAITextGenerator(
            @NonNull String modelName,
            @NonNull ChatCompletionServices chatCompletionServices,
            SimpleOpenAITextGeneratorOptions options,
            ObjectMapper mapper) {
        this.modelName = modelName;
        this.chatCompletionServices = chatCompletionServices;
        this.options = Objects.requireNonNullElse(options, SimpleOpenAITextGeneratorOptions.DEFAULT);
        this.mapper = Objects.requireNonNullElseGet(mapper, JsonUtils::createMapper);
    }

    @Override
    public String generate(String prompt, int maxTokens) {
        if (Strings.isNullOrEmpty(prompt)) {
            return null;
        }
        final var request = toChatRequest(prompt, maxTokens);
        logDataDebug("Request to model: {}", request);
        final Chat response;
        try {
            response = chatCompletionServices.chatCompletions()
                    .create(request)
                    .join();
        }
        catch (Exception e) {
            log.error("Error calling model {}: {}", modelName, MnemoUtils.errorMessage(e));
            throw new MnemoException(e, ErrorType.TEXT_GENERATION_FAILURE, MnemoUtils.errorMessage(e));
        }
        logDataDebug("Response from model: {}", response);
        return extractText(response);
    }

    private ChatRequest toChatRequest(String prompt, int maxTokens) {
        final var messages = new ArrayList<ChatMessage>();
        if (!Strings.isNullOrEmpty(options.getSystemPrompt())) {
            messages.add(ChatMessage.SystemMessage.of(options.getSystemPrompt()));
        }
        messages.add(ChatMessage.UserMessage.of(prompt));
        final var builder = ChatRequest.builder()
                .model(modelName)
                .messages(messages)
                .n(1);
        if (maxTokens > 0) {
            builder.maxCompletionTokens(maxTokens);
        }
        if (options.getTemperature() != null) {
            builder.temperature(options.getTemperature());
        }
        if (options.getSeed() != null) {
            builder.seed(options.getSeed());
        }
        return builder.build();
    }

    private String extractText(Chat response) {
        if (response == null || response.getChoices() == null) {
            log.warn("Model {} returned no choices", modelName);
            return null;
        }
        final var text = response.getChoices()
                .stream()
                .findFirst()
                .map(Chat.Choice::getMessage)
                .map(ChatMessage.ResponseMessage::getContent)
                .orElse(null);
        if (Strings.isNullOrEmpty(text)) {
            log.warn("Model {} returned an empty reply", modelName);
            return null;
        }
        return text;
    }

    private void logDataDebug(String fmtStr, Object node) {
        if (log.isDebugEnabled()) {
            try {
                log.debug(fmtStr, mapper.writeValueAsString(node));
            }
            catch (Exception e) {
                log.debug("Could not serialize model payload for logging: {}", MnemoUtils.errorMessage(e));
            }
        }
    }
}
