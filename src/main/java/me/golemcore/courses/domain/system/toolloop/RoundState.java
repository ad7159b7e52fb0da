package me.golemcore.courses.domain.system.toolloop;

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

import me.golemcore.courses.domain.model.ToolResult;

import java.util.ArrayList;
import java.util.List;

/**
 * Per-invocation counters: tool rounds completed, completion requests issued,
 * tool calls executed and every tool result collected so far. Created fresh
 * for each invocation and never shared.
 */
final class RoundState {

    private final int maxRounds;
    private int round;
    private int llmCalls;
    private int toolExecutions;
    private int conversationChars;
    private boolean followupSpent;
    private final List<ToolResult> collectedResults = new ArrayList<>();

    RoundState(int maxRounds) {
        this.maxRounds = maxRounds;
    }

    void recordLlmCall() {
        llmCalls++;
    }

    void completeRound(List<ToolResult> results) {
        round++;
        toolExecutions += results.size();
        collectedResults.addAll(results);
    }

    void recordConversationChars(int chars) {
        conversationChars = chars;
    }

    /**
     * Claims the single follow-up request with tools re-attached. Returns false
     * once it has been used in this invocation.
     */
    boolean tryClaimFollowup() {
        if (followupSpent) {
            return false;
        }
        followupSpent = true;
        return true;
    }

    boolean isLimitReached() {
        return round >= maxRounds;
    }

    int round() {
        return round;
    }

    int llmCalls() {
        return llmCalls;
    }

    int toolExecutions() {
        return toolExecutions;
    }

    int conversationChars() {
        return conversationChars;
    }

    List<ToolResult> collectedResults() {
        return List.copyOf(collectedResults);
    }
}
