package me.golemcore.coursemate.adapter.outbound.llm;

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
import dev.langchain4j.model.chat.request.ToolChoice;
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
import dev.langchain4j.model.output.FinishReason;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.coursemate.domain.model.LlmRequest;
import me.golemcore.coursemate.domain.model.LlmResponse;
import me.golemcore.coursemate.domain.model.LlmUsage;
import me.golemcore.coursemate.domain.model.Message;
import me.golemcore.coursemate.domain.model.ToolDefinition;
import me.golemcore.coursemate.infrastructure.config.CoursemateProperties;
import me.golemcore.coursemate.port.outbound.LlmPort;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * LLM adapter using the langchain4j library.
 *
 * <p>
 * Supports:
 * <ul>
 * <li>Anthropic (Claude models)
 * <li>OpenAI and any OpenAI-compatible API endpoint
 * </ul>
 *
 * <p>
 * Domain messages are converted segment by segment: text becomes
 * {@link UserMessage} or {@link AiMessage}, tool invocations become
 * {@link ToolExecutionRequest}s on the assistant message and tool outcomes
 * become {@link ToolExecutionResultMessage}s. The adapter makes exactly one
 * provider call per request; retries are disabled on the underlying models.
 *
 * <p>
 * Configuration via {@code coursemate.llm.*}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class Langchain4jAdapter implements LlmPort {

    private static final String PROVIDER_ANTHROPIC = "anthropic";
    private static final String SCHEMA_KEY_PROPERTIES = "properties";
    private static final TypeReference<Map<String, Object>> MAP_TYPE_REF = new TypeReference<>() {
    };

    private final CoursemateProperties properties;
    private final ObjectMapper objectMapper;

    private ChatModel chatModel;
    private volatile boolean initialized = false;

    public synchronized void initialize() {
        if (initialized) {
            return;
        }

        String model = properties.getLlm().getModel();
        this.chatModel = createModel(model);
        initialized = true;
        log.info("Langchain4j adapter initialized: provider={}, model={}", properties.getLlm().getProvider(), model);
    }

    private void ensureInitialized() {
        if (!initialized) {
            initialize();
        }
    }

    /**
     * Create a model instance based on configuration.
     */
    private ChatModel createModel(String modelName) {
        CoursemateProperties.LlmProperties config = properties.getLlm();
        if (config.getApiKey() == null || config.getApiKey().isBlank()) {
            throw new IllegalStateException("LLM provider not configured: set coursemate.llm.api-key");
        }

        if (PROVIDER_ANTHROPIC.equals(config.getProvider())) {
            var builder = AnthropicChatModel.builder()
                    .apiKey(config.getApiKey())
                    .modelName(modelName)
                    .temperature(config.getTemperature())
                    .maxTokens(config.getMaxTokens())
                    .maxRetries(0)
                    .timeout(Duration.ofMillis(config.getTimeoutMs()));
            if (config.getBaseUrl() != null && !config.getBaseUrl().isBlank()) {
                builder.baseUrl(config.getBaseUrl());
            }
            return builder.build();
        }

        // All non-Anthropic providers use OpenAI-compatible API
        var builder = OpenAiChatModel.builder()
                .apiKey(config.getApiKey())
                .modelName(modelName)
                .temperature(config.getTemperature())
                .maxTokens(config.getMaxTokens())
                .maxRetries(0)
                .timeout(Duration.ofMillis(config.getTimeoutMs()));
        if (config.getBaseUrl() != null && !config.getBaseUrl().isBlank()) {
            builder.baseUrl(config.getBaseUrl());
        }
        return builder.build();
    }

    @Override
    public String getProviderId() {
        return properties.getLlm().getProvider();
    }

    @Override
    public CompletableFuture<LlmResponse> chat(LlmRequest request) {
        return CompletableFuture.supplyAsync(() -> {
            ensureInitialized();
            ChatRequest chatRequest = buildChatRequest(request);

            try {
                return convertResponse(chatModel.chat(chatRequest));
            } catch (RateLimitException e) {
                log.warn("[LLM] Rate limit hit: {}", e.getMessage());
                throw new IllegalStateException("LLM rate limit exceeded: " + e.getMessage(), e);
            } catch (RuntimeException e) {
                log.error("[LLM] Chat failed", e);
                throw new IllegalStateException("LLM chat failed: " + e.getMessage(), e);
            }
        });
    }

    @Override
    public String getCurrentModel() {
        return properties.getLlm().getModel();
    }

    /**
     * Per-request parameters override the model defaults. Tools and the tool
     * choice are only sent when the request offers tools.
     */
    ChatRequest buildChatRequest(LlmRequest request) {
        ChatRequest.Builder builder = ChatRequest.builder()
                .messages(convertMessages(request))
                .modelName(request.getModel() != null ? request.getModel() : getCurrentModel())
                .temperature(request.getTemperature())
                .maxOutputTokens(request.getMaxTokens() != null
                        ? request.getMaxTokens()
                        : properties.getLlm().getMaxTokens());

        List<ToolSpecification> tools = convertTools(request);
        if (!tools.isEmpty()) {
            log.trace("Calling LLM with {} tools", tools.size());
            builder.toolSpecifications(tools)
                    .toolChoice(toToolChoice(request.getToolChoice()));
        }
        return builder.build();
    }

    private static ToolChoice toToolChoice(LlmRequest.ToolChoice toolChoice) {
        if (toolChoice != LlmRequest.ToolChoice.AUTO) {
            throw new IllegalArgumentException("Tools offered with unsupported tool choice: " + toolChoice);
        }
        return ToolChoice.AUTO;
    }

    List<ChatMessage> convertMessages(LlmRequest request) {
        List<ChatMessage> messages = new ArrayList<>();

        if (request.getSystemPrompt() != null && !request.getSystemPrompt().isBlank()) {
            messages.add(SystemMessage.from(request.getSystemPrompt()));
        }

        for (Message msg : request.getMessages()) {
            switch (msg.getRole()) {
            case Message.ROLE_USER -> convertUserMessage(msg, messages);
            case Message.ROLE_ASSISTANT -> messages.add(convertAssistantMessage(msg));
            default -> log.warn("Unknown message role: {}, skipping", msg.getRole());
            }
        }
        return messages;
    }

    private void convertUserMessage(Message msg, List<ChatMessage> messages) {
        // Tool outcomes travel as separate result messages; the provider groups them
        for (Message.Segment outcome : msg.getToolOutcomes()) {
            messages.add(ToolExecutionResultMessage.from(
                    outcome.getToolCallId(),
                    outcome.getToolName(),
                    outcome.getText() != null ? outcome.getText() : ""));
        }
        String text = msg.getText();
        if (text != null && !text.isBlank()) {
            messages.add(UserMessage.from(text));
        }
    }

    private AiMessage convertAssistantMessage(Message msg) {
        String text = msg.getText();
        if (!msg.hasToolCalls()) {
            return AiMessage.from(text != null ? text : "");
        }

        List<ToolExecutionRequest> toolRequests = msg.getToolCalls().stream()
                .map(tc -> ToolExecutionRequest.builder()
                        .id(tc.getId())
                        .name(tc.getName())
                        .arguments(convertArgsToJson(tc.getArguments()))
                        .build())
                .toList();
        return text != null && !text.isBlank()
                ? AiMessage.from(text, toolRequests)
                : AiMessage.from(toolRequests);
    }

    List<ToolSpecification> convertTools(LlmRequest request) {
        if (!request.hasTools()) {
            return Collections.emptyList();
        }
        return request.getTools().stream()
                .map(this::convertToolDefinition)
                .toList();
    }

    private ToolSpecification convertToolDefinition(ToolDefinition tool) {
        ToolSpecification.Builder builder = ToolSpecification.builder()
                .name(tool.getName())
                .description(tool.getDescription());

        JsonObjectSchema.Builder schemaBuilder = JsonObjectSchema.builder();
        for (Map.Entry<String, Object> entry : tool.getProperties().entrySet()) {
            schemaBuilder.addProperty(entry.getKey(), toJsonSchemaElement(asSchema(entry.getValue())));
        }
        if (!tool.getRequired().isEmpty()) {
            schemaBuilder.required(tool.getRequired());
        }
        return builder.parameters(schemaBuilder.build()).build();
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> asSchema(Object value) {
        return value instanceof Map<?, ?> ? (Map<String, Object>) value : Map.of();
    }

    @SuppressWarnings("unchecked")
    private JsonSchemaElement toJsonSchemaElement(Map<String, Object> paramSchema) {
        String type = (String) paramSchema.get("type");
        String description = (String) paramSchema.get("description");
        boolean hasDescription = description != null && !description.isBlank();

        // Enum values take priority
        if (paramSchema.get("enum") instanceof List<?> enumValues && !enumValues.isEmpty()) {
            JsonEnumSchema.Builder builder = JsonEnumSchema.builder()
                    .enumValues(enumValues.stream().map(String::valueOf).toList());
            if (hasDescription) {
                builder.description(description);
            }
            return builder.build();
        }

        switch (type != null ? type : "string") {
        case "integer" -> {
            JsonIntegerSchema.Builder builder = JsonIntegerSchema.builder();
            if (hasDescription) {
                builder.description(description);
            }
            return builder.build();
        }
        case "number" -> {
            JsonNumberSchema.Builder builder = JsonNumberSchema.builder();
            if (hasDescription) {
                builder.description(description);
            }
            return builder.build();
        }
        case "boolean" -> {
            JsonBooleanSchema.Builder builder = JsonBooleanSchema.builder();
            if (hasDescription) {
                builder.description(description);
            }
            return builder.build();
        }
        case "array" -> {
            JsonArraySchema.Builder builder = JsonArraySchema.builder();
            if (hasDescription) {
                builder.description(description);
            }
            builder.items(toJsonSchemaElement(asSchema(paramSchema.get("items"))));
            return builder.build();
        }
        case "object" -> {
            JsonObjectSchema.Builder builder = JsonObjectSchema.builder();
            if (hasDescription) {
                builder.description(description);
            }
            Map<String, Object> nestedProps = asSchema(paramSchema.get(SCHEMA_KEY_PROPERTIES));
            for (Map.Entry<String, Object> entry : nestedProps.entrySet()) {
                builder.addProperty(entry.getKey(), toJsonSchemaElement(asSchema(entry.getValue())));
            }
            if (paramSchema.get("required") instanceof List<?> required && !required.isEmpty()) {
                builder.required((List<String>) required);
            }
            return builder.build();
        }
        default -> {
            // Strings and unknown types
            JsonStringSchema.Builder builder = JsonStringSchema.builder();
            if (hasDescription) {
                builder.description(description);
            }
            return builder.build();
        }
        }
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
            log.trace("Parsed {} tool calls from response", toolCalls.size());
        }

        LlmUsage usage = null;
        if (response.tokenUsage() != null) {
            Integer input = response.tokenUsage().inputTokenCount();
            Integer output = response.tokenUsage().outputTokenCount();
            usage = LlmUsage.of(input != null ? input : 0, output != null ? output : 0);
        }

        boolean toolRequest = response.finishReason() == FinishReason.TOOL_EXECUTION
                || (toolCalls != null && !toolCalls.isEmpty());

        return LlmResponse.builder()
                .content(aiMessage.text())
                .toolCalls(toolCalls)
                .usage(usage)
                .model(getCurrentModel())
                .stopReason(toolRequest ? LlmResponse.StopReason.TOOL_REQUEST : LlmResponse.StopReason.FINAL)
                .build();
    }

    private String convertArgsToJson(Map<String, Object> args) {
        if (args == null || args.isEmpty()) {
            return "{}";
        }
        try {
            return objectMapper.writeValueAsString(args);
        } catch (Exception e) {
            log.warn("Failed to serialize tool arguments: {}", e.getMessage());
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
            log.warn("Failed to parse tool arguments: {}", e.getMessage());
            return Collections.emptyMap();
        }
    }
}
