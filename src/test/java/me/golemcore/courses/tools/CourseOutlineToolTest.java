package me.golemcore.courses.tools;

import me.golemcore.courses.domain.model.CourseOutline;
import me.golemcore.courses.domain.model.ToolOutput;
import me.golemcore.courses.port.outbound.CourseContentPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.UncheckedIOException;
import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class CourseOutlineToolTest {

    private CourseContentPort contentPort;
    private CourseOutlineTool tool;

    @BeforeEach
    void setUp() {
        contentPort = mock(CourseContentPort.class);
        tool = new CourseOutlineTool(contentPort);
    }

    @Test
    void shouldRenderOutlineAndReportCourseAsSource() {
        CourseOutline outline = CourseOutline.builder()
                .title("MCP: Build Rich-Context AI Apps")
                .courseLink("https://example.com/mcp")
                .instructor("Jane Doe")
                .lessons(List.of(
                        new CourseOutline.Lesson(0, "Introduction", "https://example.com/mcp/0"),
                        new CourseOutline.Lesson(1, "Why MCP", null)))
                .build();
        when(contentPort.outline("MCP")).thenReturn(CompletableFuture.completedFuture(Optional.of(outline)));

        ToolOutput output = tool.execute(Map.of("course_name", "MCP")).join();

        assertTrue(output.isSuccess());
        assertEquals("Course: MCP: Build Rich-Context AI Apps\n"
                + "Link: https://example.com/mcp\n"
                + "Instructor: Jane Doe\n"
                + "Lessons (2):\n"
                + "- Lesson 0: Introduction\n"
                + "- Lesson 1: Why MCP", output.getOutput());
        assertEquals(List.of("MCP: Build Rich-Context AI Apps"), output.getSources());
    }

    @Test
    void shouldOmitMissingLinkAndInstructor() {
        CourseOutline outline = CourseOutline.builder().title("Bare").build();
        when(contentPort.outline("Bare")).thenReturn(CompletableFuture.completedFuture(Optional.of(outline)));

        assertEquals("Course: Bare\nLessons (0):", tool.execute(Map.of("course_name", "Bare")).join().getOutput());
    }

    @Test
    void shouldFallBackToRequestedNameWhenOutlineHasNoTitle() {
        CourseOutline untitled = CourseOutline.builder()
                .lessons(List.of(new CourseOutline.Lesson(1, "Why MCP", null)))
                .build();
        when(contentPort.outline("MCP")).thenReturn(CompletableFuture.completedFuture(Optional.of(untitled)));

        ToolOutput output = tool.execute(Map.of("course_name", "MCP")).join();

        assertTrue(output.isSuccess());
        assertEquals("Course: MCP\nLessons (1):\n- Lesson 1: Why MCP", output.getOutput());
        assertEquals(List.of("MCP"), output.getSources());
    }

    @Test
    void shouldCancelOutlineLookupWhenCancelled() {
        CompletableFuture<Optional<CourseOutline>> lookup = new CompletableFuture<>();
        when(contentPort.outline("MCP")).thenReturn(lookup);

        tool.execute(Map.of("course_name", "MCP")).cancel(true);

        assertTrue(lookup.isCancelled());
    }

    @Test
    void shouldReportUnknownCourse() {
        when(contentPort.outline("XYZ")).thenReturn(CompletableFuture.completedFuture(Optional.empty()));

        ToolOutput output = tool.execute(Map.of("course_name", "XYZ")).join();

        assertTrue(output.isSuccess());
        assertEquals("No course found matching 'XYZ'.", output.getOutput());
    }

    @Test
    void shouldTurnLookupFailureIntoFailureOutput() {
        when(contentPort.outline("MCP")).thenReturn(CompletableFuture.failedFuture(
                new UncheckedIOException(new IOException("HTTP 503"))));

        ToolOutput output = tool.execute(Map.of("course_name", "MCP")).join();

        assertFalse(output.isSuccess());
        assertTrue(output.getError().startsWith("Course outline lookup failed"));
    }

    @Test
    void shouldRequireCourseName() {
        ToolOutput output = tool.execute(Map.of()).join();

        assertFalse(output.isSuccess());
        assertEquals("course_name is required", output.getError());
        verify(contentPort, never()).outline(any());
    }
}
