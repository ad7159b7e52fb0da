package me.golemcore.courses.domain.service;

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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.courses.domain.component.ToolComponent;
import me.golemcore.courses.domain.model.CallHistoryEntry;
import me.golemcore.courses.domain.model.ToolDefinition;
import me.golemcore.courses.domain.model.ToolOutput;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Holds the registered tools, dispatches tool calls by name and accumulates
 * what was executed during the current question.
 *
 * <p>
 * Tools are looked up by the name in their definition. Every execution is
 * appended to the call history, and the sources each tool reports are merged
 * into a de-duplicated, first-seen ordered set until {@link #reset()} is
 * called. Accumulators are guarded by a single lock; tools themselves run
 * outside of it.
 */
@Slf4j
public class ToolRegistry {

    private final Object lock = new Object();
    private final Map<String, ToolComponent> tools = new LinkedHashMap<>();
    private final List<CallHistoryEntry> callHistory = new ArrayList<>();
    private final Set<String> allSources = new LinkedHashSet<>();
    private final Map<String, List<String>> lastSourcesByTool = new LinkedHashMap<>();
    private List<String> lastSources = List.of();

    private final long toolTimeoutSeconds;
    private final Clock clock;

    public ToolRegistry(long toolTimeoutSeconds, Clock clock) {
        if (toolTimeoutSeconds <= 0) {
            throw new IllegalStateException("tools.timeout-seconds must be positive, got " + toolTimeoutSeconds);
        }
        this.toolTimeoutSeconds = toolTimeoutSeconds;
        this.clock = clock;
    }

    /**
     * Registers a tool under its definition name.
     *
     * @throws IllegalArgumentException
     *             if the definition has no name
     * @throws DuplicateToolException
     *             if the name is already registered
     */
    public void register(ToolComponent tool) {
        ToolDefinition definition = tool.getDefinition();
        String name = definition != null ? definition.getName() : null;
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Tool must have a 'name' in its definition");
        }
        synchronized (lock) {
            if (tools.containsKey(name)) {
                throw new DuplicateToolException(name);
            }
            tools.put(name, tool);
        }
        log.debug("[Tools] Registered tool: {}", name);
    }

    /**
     * Definitions of all enabled tools, in registration order.
     */
    public List<ToolDefinition> definitions() {
        synchronized (lock) {
            List<ToolDefinition> definitions = new ArrayList<>();
            for (ToolComponent tool : tools.values()) {
                if (tool.isEnabled()) {
                    definitions.add(tool.getDefinition());
                }
            }
            return definitions;
        }
    }

    /**
     * Executes a tool by name. Never throws: unknown tools, disabled tools,
     * exceptions and timeouts all come back as failure outputs.
     */
    public ToolOutput execute(String name, Map<String, Object> arguments) {
        ToolComponent tool;
        synchronized (lock) {
            tool = tools.get(name);
        }
        if (tool == null) {
            log.warn("[Tools] Unknown tool requested: {}", name);
            return ToolOutput.failure("Tool '" + name + "' not found");
        }
        if (!tool.isEnabled()) {
            log.warn("[Tools] Disabled tool requested: {}", name);
            return ToolOutput.failure("Tool '" + name + "' is disabled");
        }

        Map<String, Object> safeArguments = arguments != null ? arguments : Map.of();
        synchronized (lock) {
            callHistory.add(new CallHistoryEntry(name, safeArguments, clock.instant()));
        }

        ToolOutput output = invoke(tool, name, safeArguments);
        recordSources(name, output);
        log.debug("[Tools] {} finished: success={}, sources={}", name, output.isSuccess(),
                output.getSources() != null ? output.getSources().size() : 0);
        return output;
    }

    private ToolOutput invoke(ToolComponent tool, String name, Map<String, Object> arguments) {
        CompletableFuture<ToolOutput> future = null;
        try {
            future = tool.execute(arguments);
            ToolOutput output = future != null ? future.get(toolTimeoutSeconds, TimeUnit.SECONDS) : null;
            if (output == null) {
                return ToolOutput.failure("Tool execution failed: " + name + " returned no result");
            }
            return output;
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("[Tools] {} timed out after {}s", name, toolTimeoutSeconds);
            return ToolOutput.failure("Tool execution failed: " + name + " timed out after "
                    + toolTimeoutSeconds + "s");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ToolOutput.failure("Tool execution failed: interrupted");
        } catch (ExecutionException | RuntimeException e) {
            log.warn("[Tools] Tool execution failed: {}", name, e);
            return ToolOutput.failure("Tool execution failed: " + safeCauseMessage(e));
        }
    }

    private void recordSources(String name, ToolOutput output) {
        List<String> sources = output.getSources();
        if (sources == null || sources.isEmpty()) {
            return;
        }
        List<String> copy = List.copyOf(sources);
        synchronized (lock) {
            lastSourcesByTool.put(name, copy);
            lastSources = copy;
            allSources.addAll(copy);
        }
    }

    /**
     * Every source reported since the last reset, de-duplicated, in first-seen
     * order.
     */
    public List<String> allSources() {
        synchronized (lock) {
            return List.copyOf(allSources);
        }
    }

    /**
     * Sources reported by the most recent execution that reported any.
     */
    public List<String> lastSources() {
        synchronized (lock) {
            return lastSources;
        }
    }

    public List<String> lastSources(String toolName) {
        synchronized (lock) {
            return lastSourcesByTool.getOrDefault(toolName, List.of());
        }
    }

    public List<CallHistoryEntry> callHistory() {
        synchronized (lock) {
            return List.copyOf(callHistory);
        }
    }

    /**
     * Human-readable account of the tool calls made since the last reset, or an
     * empty string when nothing has run.
     */
    public String sequentialSummary() {
        List<CallHistoryEntry> history = callHistory();
        if (history.isEmpty()) {
            return "";
        }
        StringBuilder summary = new StringBuilder();
        summary.append("Executed ").append(history.size()).append(" tool call(s):\n");
        for (int i = 0; i < history.size(); i++) {
            CallHistoryEntry entry = history.get(i);
            Map<String, Object> args = entry.arguments();
            summary.append(i + 1).append(". ").append(entry.toolName());
            Object query = args.get("query");
            summary.append(" - '").append(query != null ? query : "N/A").append("'");
            Object course = args.get("course_name");
            if (course != null) {
                summary.append(" (course: ").append(course).append(")");
            }
            Object lesson = args.get("lesson_number");
            if (lesson != null) {
                summary.append(" (lesson: ").append(lesson).append(")");
            }
            summary.append('\n');
        }
        List<String> sources = allSources();
        if (!sources.isEmpty()) {
            summary.append("\nSources from ").append(sources.size()).append(" locations");
        }
        return summary.toString().strip();
    }

    /**
     * Clears call history and accumulated sources. Registered tools are kept.
     */
    public void reset() {
        synchronized (lock) {
            callHistory.clear();
            allSources.clear();
            lastSourcesByTool.clear();
            lastSources = List.of();
        }
    }

    private static String safeCauseMessage(Throwable error) {
        Throwable cursor = error;
        while (cursor.getCause() != null && cursor.getCause() != cursor) {
            cursor = cursor.getCause();
        }
        String message = cursor.getMessage();
        if (message == null || message.isBlank()) {
            message = cursor.getClass().getSimpleName();
        }
        return message;
    }
}
