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

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.courses.port.outbound.CourseContentPort;
import me.golemcore.courses.port.outbound.LlmPort;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.info.BuildProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.Set;

/**
 * Shared infrastructure beans and startup checks.
 *
 * <p>
 * On startup the completion provider is validated and the effective
 * configuration is logged. An unknown provider fails the context.
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class AutoConfiguration {

    static final Set<String> SUPPORTED_PROVIDERS = Set.of("anthropic", "openai");

    private final CourseAssistantProperties properties;
    private final LlmPort llmPort;
    private final CourseContentPort contentPort;
    private final ObjectProvider<BuildProperties> buildPropertiesProvider;

    @Bean
    public static Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public static ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    @PostConstruct
    public void init() {
        String provider = properties.getLlm().getProvider();
        if (provider == null || !SUPPORTED_PROVIDERS.contains(provider)) {
            throw new IllegalStateException("Unsupported LLM provider: " + provider
                    + ". Expected one of " + SUPPORTED_PROVIDERS);
        }

        BuildProperties buildProps = buildPropertiesProvider.getIfAvailable();
        String version = buildProps != null ? buildProps.getVersion() : "dev";
        log.info("GolemCore Courses v{} starting...", version);
        log.info("LLM Provider: {} (model {})", provider, llmPort.getCurrentModel());
        if (!llmPort.isAvailable()) {
            log.warn("LLM API key is not configured, questions will be answered with an apology");
        }
        log.info("Content service: {}", contentPort.isAvailable()
                ? properties.getContent().getUrl()
                : "not configured");
        log.info("Tool loop: max rounds {}, max conversation chars {}",
                properties.getToolLoop().getMaxRounds(),
                properties.getToolLoop().getMaxConversationChars());
    }
}
