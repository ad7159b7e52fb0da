package me.golemcore.courses.domain.model;

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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * One turn of the working conversation sent to the completion service.
 *
 * <p>
 * A user turn carries text. An assistant turn carries text and, when the model
 * asked for tools, the tool calls it made. A tool turn carries every
 * {@link ToolResult} produced in answer to the preceding assistant turn, so
 * results are always sent back together in a single turn.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Message {

    public static final String ROLE_USER = "user";
    public static final String ROLE_ASSISTANT = "assistant";
    public static final String ROLE_TOOL = "tool";

    private String role;
    private String content;
    private List<ToolCall> toolCalls;
    private List<ToolResult> toolResults;

    public static Message user(String content) {
        return Message.builder()
                .role(ROLE_USER)
                .content(content)
                .build();
    }

    public static Message assistant(String content, List<ToolCall> toolCalls) {
        return Message.builder()
                .role(ROLE_ASSISTANT)
                .content(content)
                .toolCalls(toolCalls != null ? List.copyOf(toolCalls) : null)
                .build();
    }

    public static Message toolResults(List<ToolResult> results) {
        return Message.builder()
                .role(ROLE_TOOL)
                .toolResults(List.copyOf(results))
                .build();
    }

    public boolean isUserMessage() {
        return ROLE_USER.equals(role);
    }

    public boolean isAssistantMessage() {
        return ROLE_ASSISTANT.equals(role);
    }

    public boolean isToolMessage() {
        return ROLE_TOOL.equals(role);
    }

    public boolean hasToolCalls() {
        return toolCalls != null && !toolCalls.isEmpty();
    }

    public boolean hasToolResults() {
        return toolResults != null && !toolResults.isEmpty();
    }

    /**
     * A tool invocation requested by the model. The id is opaque and must be
     * echoed back on the matching result.
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ToolCall {
        private String id;
        private String name;
        private Map<String, Object> arguments;
    }
}
