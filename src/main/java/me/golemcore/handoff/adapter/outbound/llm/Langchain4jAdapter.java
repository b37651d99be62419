/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */
package me.golemcore.handoff.adapter.outbound.llm;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.agent.tool.ToolExecutionRequest;
import dev.langchain4j.agent.tool.ToolSpecification;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.ToolExecutionResultMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.exception.RateLimitException;
import dev.langchain4j.model.anthropic.AnthropicChatModel;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.request.json.JsonArraySchema;
import dev.langchain4j.model.chat.request.json.JsonBooleanSchema;
import dev.langchain4j.model.chat.request.json.JsonEnumSchema;
import dev.langchain4j.model.chat.request.json.JsonIntegerSchema;
import dev.langchain4j.model.chat.request.json.JsonNumberSchema;
import dev.langchain4j.model.chat.request.json.JsonObjectSchema;
import dev.langchain4j.model.chat.request.json.JsonSchemaElement;
import dev.langchain4j.model.chat.request.json.JsonStringSchema;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.openai.OpenAiChatModel;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.handoff.domain.model.CapabilityDefinition;
import me.golemcore.handoff.domain.model.LlmRequest;
import me.golemcore.handoff.domain.model.LlmResponse;
import me.golemcore.handoff.domain.model.Message;
import me.golemcore.handoff.infrastructure.config.HandoffProperties;
import me.golemcore.handoff.port.outbound.LlmPort;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * LLM adapter using the langchain4j library.
 *
 * <p>
 * Supports Anthropic (Claude models) and any OpenAI-compatible endpoint,
 * selected by {@code handoff.llm.provider}. Capability definitions are passed
 * as tool specifications; tool calls in the response are returned as
 * {@link Message.ToolCall}s.
 *
 * <p>
 * Rate-limit errors are retried with exponential backoff. Any other failure
 * completes the future exceptionally. Cancelling the returned future stops
 * further retries; an attempt already sent to the provider runs to its end. The model is created lazily on first use
 * so the application starts without credentials.
 */
@Component
@Slf4j
public class Langchain4jAdapter implements LlmPort {

    private static final int MAX_RETRIES = 3;
    private static final long INITIAL_BACKOFF_MS = 2_000;
    private static final double BACKOFF_MULTIPLIER = 2.0;
    private static final String PROVIDER_ANTHROPIC = "anthropic";
    private static final String PROVIDER_OPENAI = "openai";
    private static final String SCHEMA_KEY_PROPERTIES = "properties";
    private static final TypeReference<Map<String, Object>> MAP_TYPE_REF = new TypeReference<>() {
    };

    private final HandoffProperties properties;
    private final ObjectMapper objectMapper;

    private volatile ChatModel chatModel;

    public Langchain4jAdapter(HandoffProperties properties, ObjectMapper objectMapper) {
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    // Visible for testing
    Langchain4jAdapter(HandoffProperties properties, ObjectMapper objectMapper, ChatModel chatModel) {
        this(properties, objectMapper);
        this.chatModel = chatModel;
    }

    @Override
    public CompletableFuture<LlmResponse> chat(LlmRequest request) {
        CompletableFuture<LlmResponse> result = new CompletableFuture<>();
        CompletableFuture.runAsync(() -> {
            try {
                result.complete(callWithRetry(request, result));
            } catch (CancellationException e) {
                log.debug("[LLM] Chat abandoned: {}", e.getMessage());
            } catch (CompletionException e) {
                result.completeExceptionally(e.getCause() != null ? e.getCause() : e);
            } catch (RuntimeException e) {
                result.completeExceptionally(e);
            }
        });
        return result;
    }

    /**
     * Runs the model call, retrying rate-limit errors with backoff. Stops
     * before the next attempt once {@code caller} has been cancelled.
     */
    private LlmResponse callWithRetry(LlmRequest request, CompletableFuture<LlmResponse> caller) {
        ChatModel model = getChatModel();
        List<ChatMessage> messages = convertMessages(request);
        List<ToolSpecification> tools = convertTools(request);

        for (int attempt = 0; attempt <= MAX_RETRIES; attempt++) {
            if (caller.isCancelled()) {
                throw new CancellationException("caller cancelled before attempt " + (attempt + 1));
            }
            try {
                ChatRequest.Builder chatRequest = ChatRequest.builder().messages(messages);
                if (!tools.isEmpty()) {
                    log.trace("[LLM] Calling model with {} tools", tools.size());
                    chatRequest.toolSpecifications(tools);
                }
                return convertResponse(model.chat(chatRequest.build()));
            } catch (RuntimeException e) {
                if (isRateLimitError(e) && attempt < MAX_RETRIES && !caller.isCancelled()) {
                    long backoffMs = (long) (INITIAL_BACKOFF_MS * Math.pow(BACKOFF_MULTIPLIER, attempt));
                    log.warn("[LLM] Rate limit hit (attempt {}/{}), retrying in {}ms...",
                            attempt + 1, MAX_RETRIES, backoffMs);
                    sleep(backoffMs);
                } else if (caller.isCancelled()) {
                    throw new CancellationException("caller cancelled after attempt " + (attempt + 1));
                } else {
                    log.error("[LLM] Chat failed: {}", e.getMessage());
                    throw new CompletionException("LLM chat failed: " + e.getMessage(), e);
                }
            }
        }
        throw new CompletionException(new IllegalStateException("LLM chat failed: max retries exhausted"));
    }

    private ChatModel getChatModel() {
        ChatModel model = chatModel;
        if (model == null) {
            synchronized (this) {
                if (chatModel == null) {
                    chatModel = createModel();
                    log.info("[LLM] Initialized {} model {}", properties.getLlm().getProvider(),
                            properties.getLlm().getModel());
                }
                model = chatModel;
            }
        }
        return model;
    }

    private ChatModel createModel() {
        HandoffProperties.LlmProperties config = properties.getLlm();
        if (config.getApiKey() == null || config.getApiKey().isBlank()) {
            throw new IllegalStateException("LLM API key not configured. Set handoff.llm.api-key");
        }
        Duration timeout = Duration.ofMillis(config.getTimeoutMs());

        if (PROVIDER_ANTHROPIC.equals(config.getProvider())) {
            var builder = AnthropicChatModel.builder()
                    .apiKey(config.getApiKey())
                    .modelName(config.getModel())
                    .maxRetries(0) // Retry handled by our backoff logic
                    .maxTokens(config.getMaxTokens())
                    .temperature(config.getTemperature())
                    .timeout(timeout);
            if (config.getBaseUrl() != null && !config.getBaseUrl().isBlank()) {
                builder.baseUrl(config.getBaseUrl());
            }
            return builder.build();
        }
        if (PROVIDER_OPENAI.equals(config.getProvider())) {
            var builder = OpenAiChatModel.builder()
                    .apiKey(config.getApiKey())
                    .modelName(config.getModel())
                    .maxRetries(0) // Retry handled by our backoff logic
                    .maxTokens(config.getMaxTokens())
                    .temperature(config.getTemperature())
                    .timeout(timeout);
            if (config.getBaseUrl() != null && !config.getBaseUrl().isBlank()) {
                builder.baseUrl(config.getBaseUrl());
            }
            return builder.build();
        }
        throw new IllegalStateException("Unsupported LLM provider: " + config.getProvider()
                + ". Expected anthropic or openai");
    }

    private static void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new CompletionException("LLM chat interrupted during retry backoff", ie);
        }
    }

    private boolean isRateLimitError(Throwable e) {
        Throwable current = e;
        while (current != null) {
            if (current instanceof RateLimitException) {
                return true;
            }
            String msg = current.getMessage();
            if (msg != null && (msg.contains("rate_limit") || msg.contains("Too Many Requests")
                    || msg.contains("429"))) {
                return true;
            }
            current = current.getCause();
        }
        return false;
    }

    List<ChatMessage> convertMessages(LlmRequest request) {
        List<ChatMessage> messages = new ArrayList<>();

        if (request.getSystemPrompt() != null && !request.getSystemPrompt().isBlank()) {
            messages.add(SystemMessage.from(request.getSystemPrompt()));
        }

        for (Message msg : request.getMessages()) {
            String content = msg.getContent();
            boolean hasText = content != null && !content.isBlank();
            switch (msg.getRole()) {
            case Message.ROLE_USER -> {
                // Providers reject empty text blocks
                if (hasText) {
                    messages.add(UserMessage.from(content));
                }
            }
            case Message.ROLE_ASSISTANT -> {
                if (msg.hasToolCalls()) {
                    List<ToolExecutionRequest> toolRequests = msg.getToolCalls().stream()
                            .map(tc -> ToolExecutionRequest.builder()
                                    .id(tc.getId())
                                    .name(tc.getName())
                                    .arguments(convertArgsToJson(tc.getArguments()))
                                    .build())
                            .toList();
                    messages.add(hasText ? AiMessage.from(content, toolRequests) : AiMessage.from(toolRequests));
                } else if (hasText) {
                    messages.add(AiMessage.from(content));
                }
            }
            case Message.ROLE_TOOL -> messages.add(ToolExecutionResultMessage.from(
                    msg.getToolCallId(),
                    msg.getToolName(),
                    content != null ? content : ""));
            default -> log.warn("[LLM] Unknown message role: {}, skipping", msg.getRole());
            }
        }

        return messages;
    }

    private List<ToolSpecification> convertTools(LlmRequest request) {
        if (request.getTools() == null || request.getTools().isEmpty()) {
            return Collections.emptyList();
        }
        return request.getTools().stream()
                .map(this::convertDefinition)
                .toList();
    }

    @SuppressWarnings("unchecked")
    private ToolSpecification convertDefinition(CapabilityDefinition definition) {
        ToolSpecification.Builder builder = ToolSpecification.builder()
                .name(definition.getName())
                .description(definition.getDescription());

        Map<String, Object> schema = definition.getInputSchema();
        if (schema != null) {
            Map<String, Object> props = (Map<String, Object>) schema.get(SCHEMA_KEY_PROPERTIES);
            List<String> required = (List<String>) schema.get("required");
            JsonObjectSchema.Builder schemaBuilder = JsonObjectSchema.builder();
            if (props != null) {
                for (Map.Entry<String, Object> entry : props.entrySet()) {
                    schemaBuilder.addProperty(entry.getKey(),
                            toJsonSchemaElement((Map<String, Object>) entry.getValue()));
                }
            }
            if (required != null && !required.isEmpty()) {
                schemaBuilder.required(required);
            }
            builder.parameters(schemaBuilder.build());
        }

        return builder.build();
    }

    @SuppressWarnings("unchecked")
    private JsonSchemaElement toJsonSchemaElement(Map<String, Object> paramSchema) {
        String type = (String) paramSchema.getOrDefault("type", "string");
        String description = (String) paramSchema.get("description");
        List<String> enumValues = (List<String>) paramSchema.get("enum");

        if (enumValues != null && !enumValues.isEmpty()) {
            return JsonEnumSchema.builder().enumValues(enumValues).description(description).build();
        }

        return switch (type) {
        case "integer" -> JsonIntegerSchema.builder().description(description).build();
        case "number" -> JsonNumberSchema.builder().description(description).build();
        case "boolean" -> JsonBooleanSchema.builder().description(description).build();
        case "array" -> {
            JsonArraySchema.Builder builder = JsonArraySchema.builder().description(description);
            Map<String, Object> items = (Map<String, Object>) paramSchema.get("items");
            builder.items(items != null ? toJsonSchemaElement(items) : JsonStringSchema.builder().build());
            yield builder.build();
        }
        case "object" -> {
            JsonObjectSchema.Builder builder = JsonObjectSchema.builder().description(description);
            Map<String, Object> nested = (Map<String, Object>) paramSchema.get(SCHEMA_KEY_PROPERTIES);
            if (nested != null) {
                for (Map.Entry<String, Object> entry : nested.entrySet()) {
                    builder.addProperty(entry.getKey(), toJsonSchemaElement((Map<String, Object>) entry.getValue()));
                }
            }
            yield builder.build();
        }
        default -> JsonStringSchema.builder().description(description).build();
        };
    }

    LlmResponse convertResponse(ChatResponse response) {
        AiMessage aiMessage = response.aiMessage();

        List<Message.ToolCall> toolCalls = null;
        if (aiMessage.hasToolExecutionRequests()) {
            toolCalls = aiMessage.toolExecutionRequests().stream()
                    .map(ter -> Message.ToolCall.builder()
                            .id(ter.id())
                            .name(ter.name())
                            .arguments(parseJsonArgs(ter.arguments()))
                            .build())
                    .toList();
            log.trace("[LLM] Parsed {} tool calls from response", toolCalls.size());
        }

        return LlmResponse.builder()
                .content(aiMessage.text())
                .toolCalls(toolCalls)
                .finishReason(response.finishReason() != null ? response.finishReason().name() : "stop")
                .build();
    }

    private String convertArgsToJson(Map<String, Object> args) {
        if (args == null || args.isEmpty()) {
            return "{}";
        }
        try {
            return objectMapper.writeValueAsString(args);
        } catch (Exception e) {
            log.warn("[LLM] Failed to serialize tool arguments: {}", e.getMessage());
            return "{}";
        }
    }

    private Map<String, Object> parseJsonArgs(String json) {
        if (json == null || json.isBlank()) {
            return Collections.emptyMap();
        }
        try {
            return objectMapper.readValue(json, MAP_TYPE_REF);
        } catch (Exception e) {
            log.warn("[LLM] Failed to parse tool arguments: {}", e.getMessage());
            return Collections.emptyMap();
        }
    }
}
