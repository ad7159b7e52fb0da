package me.golemcore.courses.infrastructure.config;

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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Configuration properties for the course assistant, bound from
 * application.properties.
 *
 * <p>
 * All settings live under the {@code courses.*} prefix:
 * <ul>
 * <li>{@link LlmProperties} - completion service provider and sampling</li>
 * <li>{@link ToolLoopProperties} - round limit and conversation budget</li>
 * <li>{@link ToolsProperties} - tool execution limits</li>
 * <li>{@link ContentProperties} - external course content service</li>
 * <li>{@link SessionProperties} - chat history retention</li>
 * <li>{@link HttpProperties} - shared HTTP client</li>
 * <li>{@link ConsoleProperties} - interactive console front end</li>
 * </ul>
 */
@Component
@ConfigurationProperties(prefix = "courses")
@Data
public class CourseAssistantProperties {

    private LlmProperties llm = new LlmProperties();
    private ToolLoopProperties toolLoop = new ToolLoopProperties();
    private ToolsProperties tools = new ToolsProperties();
    private ContentProperties content = new ContentProperties();
    private SessionProperties session = new SessionProperties();
    private HttpProperties http = new HttpProperties();
    private ConsoleProperties console = new ConsoleProperties();

    @Data
    public static class LlmProperties {
        private String provider = "anthropic";
        private String model = "claude-sonnet-4-20250514";
        private String apiKey;
        private String baseUrl;
        private double temperature = 0.0;
        private int maxTokens = 800;
        private long timeoutMs = 60000;
        private int maxRetries = 0;
    }

    @Data
    public static class ToolLoopProperties {
        private int maxRounds = 2;
        private int maxConversationChars = 15000;
        private int maxSummaryResults = 3;
    }

    @Data
    public static class ToolsProperties {
        private long timeoutSeconds = 30;
    }

    @Data
    public static class ContentProperties {
        private String url;
        private String apiKey;
        private int timeoutSeconds = 10;
    }

    @Data
    public static class SessionProperties {
        private int maxHistory = 2;
    }

    @Data
    public static class HttpProperties {
        private Duration connectTimeout = Duration.ofSeconds(10);
        private Duration readTimeout = Duration.ofSeconds(60);
        private Duration writeTimeout = Duration.ofSeconds(60);
        private int maxIdleConnections = 5;
        private Duration keepAlive = Duration.ofMinutes(5);
        private boolean retryOnConnectionFailure = true;
    }

    @Data
    public static class ConsoleProperties {
        private boolean enabled = false;
    }
}
