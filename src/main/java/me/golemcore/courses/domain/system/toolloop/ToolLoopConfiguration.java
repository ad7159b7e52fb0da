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

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.courses.domain.component.ToolComponent;
import me.golemcore.courses.domain.service.ToolRegistry;
import me.golemcore.courses.infrastructure.config.CourseAssistantProperties;
import me.golemcore.courses.port.outbound.LlmPort;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.List;

/** Spring wiring for ToolLoopSystem and the shared tool registry. */
@Configuration
public class ToolLoopConfiguration {

    @Bean
    public ToolRegistry toolRegistry(List<ToolComponent> tools, CourseAssistantProperties properties, Clock clock) {
        long toolTimeout = properties.getTools().getTimeoutSeconds();
        long contentTimeout = properties.getContent().getTimeoutSeconds();
        // content calls must end on their own before the registry gives up on the tool
        if (toolTimeout <= contentTimeout) {
            throw new IllegalStateException("courses.tools.timeout-seconds (" + toolTimeout
                    + ") must be greater than courses.content.timeout-seconds (" + contentTimeout + ")");
        }
        ToolRegistry registry = new ToolRegistry(toolTimeout, clock);
        for (ToolComponent tool : tools) {
            registry.register(tool);
        }
        return registry;
    }

    @Bean
    public ConversationSizeGuard conversationSizeGuard(ObjectMapper objectMapper,
            CourseAssistantProperties properties) {
        return new ConversationSizeGuard(objectMapper, properties.getToolLoop().getMaxConversationChars());
    }

    @Bean
    public ToolResultSummarizer toolResultSummarizer(CourseAssistantProperties properties) {
        return new ToolResultSummarizer(properties.getToolLoop().getMaxSummaryResults());
    }

    @Bean
    public ToolLoopSystem toolLoopSystem(LlmPort llmPort, ConversationSizeGuard sizeGuard,
            ToolResultSummarizer summarizer, CourseAssistantProperties properties) {
        return new DefaultToolLoopSystem(llmPort, sizeGuard, summarizer, properties.getToolLoop().getMaxRounds());
    }
}
