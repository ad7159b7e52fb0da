package me.golemcore.courses;

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

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for the course materials assistant.
 *
 * <p>
 * Answers questions about a course catalog by letting a language model search
 * course content through tools, in a bounded number of rounds.
 *
 * <h2>Architecture</h2>
 * <p>
 * Hexagonal architecture (Ports & Adapters):
 *
 * <pre>
 * Input Layer        → ConsoleChatRunner
 * Domain Layer       → CourseQueryService, ToolLoopSystem, ToolRegistry, tools
 * Infrastructure     → langchain4j LLM adapter, HTTP course content adapter
 * </pre>
 *
 * <h2>Configuration</h2>
 * <p>
 * All configuration via {@code application.properties} under the
 * {@code courses.*} prefix.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class CourseAssistantApplication {

    public static void main(String[] args) {
        SpringApplication.run(CourseAssistantApplication.class, args);
    }

}
