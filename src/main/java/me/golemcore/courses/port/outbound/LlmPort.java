package me.golemcore.courses.port.outbound;

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

import me.golemcore.courses.domain.model.LlmRequest;
import me.golemcore.courses.domain.model.LlmResponse;

import java.util.concurrent.CompletableFuture;

/**
 * Port for the completion service that answers questions and decides when to
 * call tools.
 */
public interface LlmPort {

    /**
     * Returns the provider identifier (e.g., "anthropic", "openai").
     */
    String getProviderId();

    /**
     * Executes a completion request. Transport and service failures complete
     * the future exceptionally.
     */
    CompletableFuture<LlmResponse> chat(LlmRequest request);

    /**
     * Returns the model identifier requests are sent to.
     */
    String getCurrentModel();

    /**
     * Checks if the provider is configured and operational.
     */
    boolean isAvailable();
}
