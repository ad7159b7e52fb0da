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
import me.golemcore.courses.domain.model.CourseOutline;
import me.golemcore.courses.domain.model.ToolDefinition;
import me.golemcore.courses.domain.model.ToolOutput;
import me.golemcore.courses.port.outbound.CourseContentPort;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Tool returning a course outline: title, link, instructor and the numbered
 * lesson list.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CourseOutlineTool implements ToolComponent {

    public static final String NAME = "get_course_outline";

    static final String PARAM_COURSE_NAME = "course_name";

    private final CourseContentPort contentPort;

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name(NAME)
                .description("Get the outline of a course: its title, link, instructor and complete lesson list")
                .inputSchema(Map.of(
                        "type", "object",
                        "properties", Map.of(
                                PARAM_COURSE_NAME, Map.of(
                                        "type", "string",
                                        "description", "Course title (partial matches work, e.g. 'MCP')")),
                        "required", List.of(PARAM_COURSE_NAME)))
                .build();
    }

    @Override
    public CompletableFuture<ToolOutput> execute(Map<String, Object> parameters) {
        Object courseArg = parameters.get(PARAM_COURSE_NAME);
        String courseName = courseArg != null ? courseArg.toString() : null;
        if (courseName == null || courseName.isBlank()) {
            return CompletableFuture.completedFuture(ToolOutput.failure("course_name is required"));
        }

        log.debug("[Tools] Course outline: course='{}'", courseName);
        CompletableFuture<Optional<CourseOutline>> pending = contentPort.outline(courseName);
        return ToolComponent.cancelling(pending
                .thenApply(outline -> toOutput(outline, courseName))
                .exceptionally(error -> {
                    Throwable cause = error.getCause() != null ? error.getCause() : error;
                    log.warn("[Tools] Course outline lookup failed for '{}': {}", courseName, cause.getMessage());
                    return ToolOutput.failure("Course outline lookup failed: " + cause.getMessage());
                }), pending);
    }

    private ToolOutput toOutput(Optional<CourseOutline> found, String courseName) {
        if (found.isEmpty()) {
            return ToolOutput.success("No course found matching '" + courseName + "'.");
        }
        CourseOutline outline = found.get();
        String title = outline.getTitle() != null && !outline.getTitle().isBlank() ? outline.getTitle() : courseName;
        StringBuilder text = new StringBuilder();
        text.append("Course: ").append(title).append('\n');
        if (outline.getCourseLink() != null && !outline.getCourseLink().isBlank()) {
            text.append("Link: ").append(outline.getCourseLink()).append('\n');
        }
        if (outline.getInstructor() != null && !outline.getInstructor().isBlank()) {
            text.append("Instructor: ").append(outline.getInstructor()).append('\n');
        }
        List<CourseOutline.Lesson> lessons = outline.getLessons() != null ? outline.getLessons() : List.of();
        text.append("Lessons (").append(lessons.size()).append("):");
        for (CourseOutline.Lesson lesson : lessons) {
            text.append("\n- Lesson ").append(lesson.getNumber()).append(": ").append(lesson.getTitle());
        }
        return ToolOutput.success(text.toString(), List.of(title));
    }
}
