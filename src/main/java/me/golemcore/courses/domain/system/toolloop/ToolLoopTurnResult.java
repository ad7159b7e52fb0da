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

/**
 * Outcome of one tool loop invocation.
 *
 * @param text
 *            answer returned to the caller, never {@code null}
 * @param terminalState
 *            {@link ToolLoopState#DONE} or {@link ToolLoopState#FAILED}
 * @param rounds
 *            tool rounds executed
 * @param llmCalls
 *            completion requests issued, the initial one included
 * @param toolExecutions
 *            individual tool calls executed across all rounds
 */
public record ToolLoopTurnResult(String text, ToolLoopState terminalState, int rounds, int llmCalls,
        int toolExecutions) {
}
