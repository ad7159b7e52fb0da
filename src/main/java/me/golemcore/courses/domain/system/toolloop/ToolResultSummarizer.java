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

import java.util.List;
import java.util.stream.Collectors;

/**
 * Builds the deterministic answer used when the model cannot be asked to
 * finish: the first few successful tool result texts, wrapped in a template
 * naming why the loop stopped. Only used once at least one tool round has run;
 * a failure before any round is answered with an apology instead.
 */
public class ToolResultSummarizer {

    static final String TRANSPORT_FAILURE_TEMPLATE = "I encountered an error during my search, but here's what I found: %s";
    static final String ROUND_LIMIT_TEMPLATE = "Reached maximum search rounds. Based on my searches: %s";
    static final String SIZE_LIMIT_TEMPLATE = "The conversation grew too long to continue searching. Based on my searches: %s";
    static final String NO_SUCCESSFUL_RESULTS = "No search results were successfully retrieved.";

    private static final String SEPARATOR = "\n\n";

    private final int maxResults;

    public ToolResultSummarizer(int maxResults) {
        if (maxResults <= 0) {
            throw new IllegalStateException("max-summary-results must be positive, got " + maxResults);
        }
        this.maxResults = maxResults;
    }

    public String summarize(List<ToolResult> results) {
        String joined = results.stream()
                .filter(ToolResult::isSuccess)
                .map(ToolResult::getContent)
                .filter(content -> content != null && !content.isBlank())
                .limit(maxResults)
                .collect(Collectors.joining(SEPARATOR));
        return joined.isEmpty() ? NO_SUCCESSFUL_RESULTS : joined;
    }

    public String afterTransportFailure(List<ToolResult> results) {
        return String.format(TRANSPORT_FAILURE_TEMPLATE, summarize(results));
    }

    public String afterRoundLimit(List<ToolResult> results) {
        return String.format(ROUND_LIMIT_TEMPLATE, summarize(results));
    }

    public String afterSizeLimit(List<ToolResult> results) {
        return String.format(SIZE_LIMIT_TEMPLATE, summarize(results));
    }
}
