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
 * States of one tool loop invocation. {@link #DONE} and {@link #FAILED} are
 * terminal; every invocation ends in exactly one of them.
 */
public enum ToolLoopState {
    INIT,
    AWAITING_COMPLETION,
    DIRECT_ANSWER,
    TOOL_ROUND,
    EXECUTING_TOOLS,
    AWAITING_FOLLOWUP,
    ROUND_LIMIT,
    DONE,
    FAILED;

    public boolean isTerminal() {
        return this == DONE || this == FAILED;
    }
}
