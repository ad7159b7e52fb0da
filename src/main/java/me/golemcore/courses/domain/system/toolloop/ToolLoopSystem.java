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

import me.golemcore.courses.domain.model.ToolDefinition;
import me.golemcore.courses.domain.service.ToolRegistry;

import java.util.List;

/**
 * Drives a bounded multi-round conversation with the completion service,
 * executing the tools it asks for until it produces an answer.
 */
public interface ToolLoopSystem {

    /**
     * Answers a query, running tool rounds as the model requests them.
     * Per-query failures never escape; they are turned into a textual answer.
     *
     * @param query
     *            the user question, sent as the only user turn
     * @param history
     *            prior conversation appended to the instructions, may be
     *            {@code null}
     * @param tools
     *            tools advertised to the model, may be {@code null} or empty
     * @param registry
     *            registry that executes tool calls; without one, tool requests
     *            are answered with whatever text accompanies them
     */
    ToolLoopTurnResult process(String query, String history, List<ToolDefinition> tools, ToolRegistry registry);

    default String respond(String query, String history, List<ToolDefinition> tools, ToolRegistry registry) {
        return process(query, history, tools, registry).text();
    }
}
