package me.golemcore.courses.domain.component;

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
import me.golemcore.courses.domain.model.ToolOutput;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * A named capability the model may invoke during question answering. Tools
 * are stateless: everything an invocation produces, provenance included, is
 * returned in its {@link ToolOutput}.
 */
public interface ToolComponent {

    /**
     * Returns the advertisement sent to the completion service. The name must be
     * unique among registered tools.
     */
    ToolDefinition getDefinition();

    /**
     * Executes the tool with the arguments the model supplied. Failures
     * belonging to the tool's domain are reported through
     * {@link ToolOutput#failure(String)} rather than a failed future.
     *
     * <p>
     * The registry cancels the returned future when the tool times out.
     * Implementations must stop their work on cancellation so that no two tool
     * executions overlap.
     */
    CompletableFuture<ToolOutput> execute(Map<String, Object> parameters);

    /**
     * Cancels {@code source} whenever {@code result} is cancelled, so that
     * cancelling a derived stage reaches the work behind it.
     */
    static <T> CompletableFuture<T> cancelling(CompletableFuture<T> result, CompletableFuture<?> source) {
        result.whenComplete((value, error) -> {
            if (result.isCancelled()) {
                source.cancel(true);
            }
        });
        return result;
    }

    default String getToolName() {
        return getDefinition().getName();
    }

    /**
     * Disabled tools stay registered but are neither advertised nor executed.
     */
    default boolean isEnabled() {
        return true;
    }
}
