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

package me.golemcore.courses.adapter.outbound.llm;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.agent.tool.ToolExecutionRequest;
import dev.langchain4j.agent.tool.ToolSpecification;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.ToolExecutionResultMessage;
import dev.langchain4j.data.message.UserMessage;
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
import dev.langchain4j.model.output.FinishReason;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.courses.domain.model.LlmRequest;
import me.golemcore.courses.domain.model.LlmResponse;
import me.golemcore.courses.domain.model.Message;
import me.golemcore.courses.domain.model.StopReason;
import me.golemcore.courses.domain.model.ToolChoice;
import me.golemcore.courses.domain.model.ToolDefinition;
import me.golemcore.courses.domain.model.ToolResult;
import me.golemcore.courses.infrastructure.config.CourseAssistantProperties;
import me.golemcore.courses.port.outbound.LlmPort;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Completion service adapter built on langchain4j.
 *
 * <p>
 * Supports the Anthropic API and any OpenAI-compatible endpoint, selected by
 * {@code courses.llm.provider}. The model is created lazily on the first
 * request. No retries are performed here; a failed request completes the
 * returned future exceptionally.
 */
@Component
@Slf4j
public class Langchain4jAdapter implements LlmPort {

    private static final String PROVIDER_ANTHROPIC = "anthropic";
    private static final String PROVIDER_OPENAI = "openai";
    private static final String SCHEMA_KEY_PROPERTIES = "properties";
    private static final String SCHEMA_KEY_DESCRIPTION = "description";
    private static final TypeReference<Map<String, Object>> MAP_TYPE_REF = new TypeReference<>() {
    };

    private final CourseAssistantProperties properties;
    private final ObjectMapper objectMapper;

    private ChatModel chatModel;
    private volatile boolean initialized = false;

    public Langchain4jAdapter(CourseAssistantProperties properties, ObjectMapper objectMapper) {
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    public synchronized void initialize() {
        if (initialized) {
            return;
        }
        if (!isAvailable()) {
            log.warn("[LLM] API key is not configured, completion requests will fail");
            return;
        }

        CourseAssistantProperties.LlmProperties llm = properties.getLlm();
        try {
            this.chatModel = createModel(llm);
            initialized = true;
            log.info("[LLM] Initialized {} model: {}", llm.getProvider(), llm.getModel());
        } catch (RuntimeException e) {
            log.warn("[LLM] Failed to initialize {} model: {}", llm.getProvider(), e.getMessage());
        }
    }

    private void ensureInitialized() {
        if (!initialized) {
            initialize();
        }
    }

    private ChatModel createModel(CourseAssistantProperties.LlmProperties llm) {
        return switch (llm.getProvider()) {
        case PROVIDER_ANTHROPIC -> createAnthropicModel(llm);
        case PROVIDER_OPENAI -> createOpenAiModel(llm);
        default -> throw new IllegalStateException("Unsupported LLM provider: " + llm.getProvider());
        };
    }

    private ChatModel createAnthropicModel(CourseAssistantProperties.LlmProperties llm) {
        var builder = AnthropicChatModel.builder()
                .apiKey(llm.getApiKey())
                .modelName(llm.getModel())
                .temperature(llm.getTemperature())
                .maxTokens(llm.getMaxTokens())
                .maxRetries(llm.getMaxRetries())
                .timeout(Duration.ofMillis(llm.getTimeoutMs()));

        if (llm.getBaseUrl() != null && !llm.getBaseUrl().isBlank()) {
            builder.baseUrl(llm.getBaseUrl());
        }
        return builder.build();
    }

    private ChatModel createOpenAiModel(CourseAssistantProperties.LlmProperties llm) {
        var builder = OpenAiChatModel.builder()
                .apiKey(llm.getApiKey())
                .modelName(llm.getModel())
                .temperature(llm.getTemperature())
                .maxTokens(llm.getMaxTokens())
                .maxRetries(llm.getMaxRetries())
                .timeout(Duration.ofMillis(llm.getTimeoutMs()));

        if (llm.getBaseUrl() != null && !llm.getBaseUrl().isBlank()) {
            builder.baseUrl(llm.getBaseUrl());
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
            if (chatModel == null) {
                throw new IllegalStateException("LLM provider is not available");
            }

            ChatRequest.Builder chatRequest = ChatRequest.builder().messages(convertMessages(request));
            List<ToolSpecification> tools = convertTools(request);
            if (!tools.isEmpty()) {
                log.trace("[LLM] Calling model with {} tools", tools.size());
                chatRequest.toolSpecifications(tools)
                        .toolChoice(convertToolChoice(request.getToolChoice()));
            }

            try {
                return convertResponse(chatModel.chat(chatRequest.build()));
            } catch (RuntimeException e) {
                log.warn("[LLM] Chat failed: {}", e.getMessage());
                throw new IllegalStateException("LLM chat failed: " + e.getMessage(), e);
            }
        });
    }

    @Override
    public String getCurrentModel() {
        return properties.getLlm().getModel();
    }

    @Override
    public boolean isAvailable() {
        String apiKey = properties.getLlm().getApiKey();
        return apiKey != null && !apiKey.isBlank();
    }

    private List<ChatMessage> convertMessages(LlmRequest request) {
        List<ChatMessage> messages = new ArrayList<>();

        if (request.getSystemPrompt() != null && !request.getSystemPrompt().isBlank()) {
            messages.add(SystemMessage.from(request.getSystemPrompt()));
        }

        for (Message msg : request.getMessages()) {
            switch (msg.getRole()) {
            case Message.ROLE_USER -> messages.add(UserMessage.from(nonNull(msg.getContent())));
            case Message.ROLE_ASSISTANT -> {
                if (msg.hasToolCalls()) {
                    List<ToolExecutionRequest> toolRequests = msg.getToolCalls().stream()
                            .map(tc -> ToolExecutionRequest.builder()
                                    .id(tc.getId())
                                    .name(tc.getName())
                                    .arguments(convertArgsToJson(tc.getArguments()))
                                    .build())
                            .toList();
                    if (msg.getContent() != null && !msg.getContent().isBlank()) {
                        messages.add(AiMessage.from(msg.getContent(), toolRequests));
                    } else {
                        messages.add(AiMessage.from(toolRequests));
                    }
                } else {
                    messages.add(AiMessage.from(nonNull(msg.getContent())));
                }
            }
            case Message.ROLE_TOOL -> {
                if (msg.hasToolResults()) {
                    for (ToolResult result : msg.getToolResults()) {
                        messages.add(ToolExecutionResultMessage.from(
                                result.getToolCallId(),
                                result.getToolName(),
                                nonNull(result.getContent())));
                    }
                }
            }
            default -> log.warn("[LLM] Unknown message role: {}, skipping", msg.getRole());
            }
        }

        return messages;
    }

    private static String nonNull(String text) {
        return text != null ? text : "";
    }

    private static dev.langchain4j.model.chat.request.ToolChoice convertToolChoice(ToolChoice toolChoice) {
        if (toolChoice == ToolChoice.REQUIRED) {
            return dev.langchain4j.model.chat.request.ToolChoice.REQUIRED;
        }
        return dev.langchain4j.model.chat.request.ToolChoice.AUTO;
    }

    private List<ToolSpecification> convertTools(LlmRequest request) {
        if (!request.hasTools()) {
            return Collections.emptyList();
        }

        return request.getTools().stream()
                .map(this::convertToolDefinition)
                .toList();
    }

    @SuppressWarnings("unchecked")
    private ToolSpecification convertToolDefinition(ToolDefinition tool) {
        ToolSpecification.Builder builder = ToolSpecification.builder()
                .name(tool.getName())
                .description(tool.getDescription());

        if (tool.getInputSchema() != null) {
            Map<String, Object> schema = tool.getInputSchema();
            Map<String, Object> params = (Map<String, Object>) schema.get(SCHEMA_KEY_PROPERTIES);
            List<String> required = (List<String>) schema.get("required");

            if (params != null) {
                JsonObjectSchema.Builder schemaBuilder = JsonObjectSchema.builder();
                for (Map.Entry<String, Object> entry : params.entrySet()) {
                    schemaBuilder.addProperty(entry.getKey(),
                            toJsonSchemaElement((Map<String, Object>) entry.getValue()));
                }
                if (required != null && !required.isEmpty()) {
                    schemaBuilder.required(required);
                }
                builder.parameters(schemaBuilder.build());
            }
        }

        return builder.build();
    }

    @SuppressWarnings("unchecked")
    private JsonSchemaElement toJsonSchemaElement(Map<String, Object> paramSchema) {
        String type = (String) paramSchema.getOrDefault("type", "string");
        String description = (String) paramSchema.get(SCHEMA_KEY_DESCRIPTION);
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
            if (paramSchema.containsKey("items")) {
                builder.items(toJsonSchemaElement((Map<String, Object>) paramSchema.get("items")));
            }
            yield builder.build();
        }
        case "object" -> {
            JsonObjectSchema.Builder builder = JsonObjectSchema.builder().description(description);
            if (paramSchema.containsKey(SCHEMA_KEY_PROPERTIES)) {
                Map<String, Object> nested = (Map<String, Object>) paramSchema.get(SCHEMA_KEY_PROPERTIES);
                for (Map.Entry<String, Object> entry : nested.entrySet()) {
                    builder.addProperty(entry.getKey(), toJsonSchemaElement((Map<String, Object>) entry.getValue()));
                }
            }
            yield builder.build();
        }
        default -> JsonStringSchema.builder().description(description).build();
        };
    }

    private LlmResponse convertResponse(ChatResponse response) {
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
                .stopReason(convertFinishReason(response.finishReason(), toolCalls != null))
                .model(getCurrentModel())
                .build();
    }

    static StopReason convertFinishReason(FinishReason finishReason, boolean hasToolCalls) {
        if (finishReason == null) {
            return hasToolCalls ? StopReason.TOOL_USE : StopReason.END;
        }
        return switch (finishReason) {
        case TOOL_EXECUTION -> StopReason.TOOL_USE;
        case LENGTH -> StopReason.MAX_TOKENS;
        default -> StopReason.END;
        };
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
