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

package me.golemcore.courses.tools;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.courses.domain.component.ToolComponent;
import me.golemcore.courses.domain.model.ChunkMetadata;
import me.golemcore.courses.domain.model.SearchResults;
import me.golemcore.courses.domain.model.ToolDefinition;
import me.golemcore.courses.domain.model.ToolOutput;
import me.golemcore.courses.port.outbound.CourseContentPort;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Tool for searching course material.
 *
 * <p>
 * Runs a semantic search against the course content store, optionally
 * restricted to a course (partial names work) and a lesson. Each hit is
 * rendered with a {@code [Course - Lesson n]} header, linked when the lesson has
 * a link, and reported as a plain {@code Course - Lesson n} source for
 * citation.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CourseSearchTool implements ToolComponent {

    public static final String NAME = "search_course_content";

    static final String PARAM_QUERY = "query";
    static final String PARAM_COURSE_NAME = "course_name";
    static final String PARAM_LESSON_NUMBER = "lesson_number";
    private static final String TYPE_STRING = "string";
    private static final String TYPE_INTEGER = "integer";
    private static final String TYPE_OBJECT = "object";

    private static final String UNKNOWN_COURSE = "unknown";

    private final CourseContentPort contentPort;

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name(NAME)
                .description("Search course materials with smart course name matching and lesson filtering")
                .inputSchema(Map.of(
                        "type", TYPE_OBJECT,
                        "properties", Map.of(
                                PARAM_QUERY, Map.of(
                                        "type", TYPE_STRING,
                                        "description", "What to search for in the course content"),
                                PARAM_COURSE_NAME, Map.of(
                                        "type", TYPE_STRING,
                                        "description",
                                        "Course title (partial matches work, e.g. 'MCP', 'Introduction')"),
                                PARAM_LESSON_NUMBER, Map.of(
                                        "type", TYPE_INTEGER,
                                        "description", "Specific lesson number to search within (e.g. 1, 2, 3)")),
                        "required", List.of(PARAM_QUERY)))
                .build();
    }

    @Override
    public CompletableFuture<ToolOutput> execute(Map<String, Object> parameters) {
        Object queryArg = parameters.get(PARAM_QUERY);
        String query = queryArg != null ? queryArg.toString() : null;
        if (query == null || query.isBlank()) {
            return CompletableFuture.completedFuture(ToolOutput.failure("query is required"));
        }

        String courseName = optionalString(parameters.get(PARAM_COURSE_NAME));
        Integer lessonNumber;
        try {
            lessonNumber = optionalInteger(parameters.get(PARAM_LESSON_NUMBER));
        } catch (NumberFormatException e) {
            return CompletableFuture.completedFuture(
                    ToolOutput.failure("lesson_number must be an integer, got '" + parameters.get(PARAM_LESSON_NUMBER)
                            + "'"));
        }

        log.debug("[Tools] Course search: query='{}', course={}, lesson={}", query, courseName, lessonNumber);
        CompletableFuture<SearchResults> pending = contentPort.search(query, courseName, lessonNumber);
        return ToolComponent.cancelling(pending.thenApply(results -> toOutput(results, courseName, lessonNumber)),
                pending);
    }

    private ToolOutput toOutput(SearchResults results, String courseName, Integer lessonNumber) {
        if (results.hasError()) {
            return ToolOutput.failure(results.getError());
        }
        if (results.isEmpty()) {
            StringBuilder message = new StringBuilder("No relevant content found");
            if (courseName != null) {
                message.append(" in course '").append(courseName).append('\'');
            }
            if (lessonNumber != null) {
                message.append(" in lesson ").append(lessonNumber);
            }
            return ToolOutput.success(message.append('.').toString());
        }

        List<String> documents = results.getDocuments();
        List<ChunkMetadata> metadata = results.getMetadata() != null ? results.getMetadata() : List.of();
        List<String> formatted = new ArrayList<>();
        List<String> sources = new ArrayList<>();
        for (int i = 0; i < documents.size(); i++) {
            ChunkMetadata meta = i < metadata.size() ? metadata.get(i) : null;
            formatted.add(header(meta) + "\n" + documents.get(i));
            sources.add(source(meta));
        }
        return ToolOutput.success(String.join("\n\n", formatted), sources);
    }

    private static String header(ChunkMetadata meta) {
        StringBuilder header = new StringBuilder("[").append(courseTitle(meta));
        if (meta != null && meta.getLessonNumber() != null) {
            String lesson = "Lesson " + meta.getLessonNumber();
            if (meta.getLessonLink() != null && !meta.getLessonLink().isBlank()) {
                header.append(" - <a href=\"").append(meta.getLessonLink())
                        .append("\" target=\"_blank\" class=\"lesson-link\">").append(lesson).append("</a>");
            } else {
                header.append(" - ").append(lesson);
            }
        }
        return header.append(']').toString();
    }

    private static String source(ChunkMetadata meta) {
        String source = courseTitle(meta);
        if (meta != null && meta.getLessonNumber() != null) {
            source += " - Lesson " + meta.getLessonNumber();
        }
        return source;
    }

    private static String courseTitle(ChunkMetadata meta) {
        return meta != null && meta.getCourseTitle() != null ? meta.getCourseTitle() : UNKNOWN_COURSE;
    }

    private static String optionalString(Object value) {
        if (value == null) {
            return null;
        }
        String text = value.toString();
        return text.isBlank() ? null : text;
    }

    private static Integer optionalInteger(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Number number) {
            try {
                return new BigDecimal(number.toString()).intValueExact();
            } catch (ArithmeticException e) {
                throw new NumberFormatException("not an integer: " + number);
            }
        }
        String text = value.toString().trim();
        return text.isEmpty() ? null : Integer.valueOf(text);
    }
}
