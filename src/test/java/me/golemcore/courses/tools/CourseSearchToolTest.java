package me.golemcore.courses.tools;

import me.golemcore.courses.domain.model.ChunkMetadata;
import me.golemcore.courses.domain.model.SearchResults;
import me.golemcore.courses.domain.model.ToolDefinition;
import me.golemcore.courses.domain.model.ToolOutput;
import me.golemcore.courses.port.outbound.CourseContentPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class CourseSearchToolTest {

    private CourseContentPort contentPort;
    private CourseSearchTool tool;

    @BeforeEach
    void setUp() {
        contentPort = mock(CourseContentPort.class);
        tool = new CourseSearchTool(contentPort);
    }

    @Test
    void shouldDescribeQueryAsOnlyRequiredParameter() {
        ToolDefinition definition = tool.getDefinition();

        assertEquals("search_course_content", definition.getName());
        assertEquals(List.of("query"), definition.getInputSchema().get("required"));
        @SuppressWarnings("unchecked")
        Map<String, Object> properties = (Map<String, Object>) definition.getInputSchema().get("properties");
        assertTrue(properties.keySet().containsAll(List.of("query", "course_name", "lesson_number")));
    }

    @Test
    void shouldFormatResultsWithHeadersAndReportSources() {
        when(contentPort.search("what is a transformer", "Intro", null))
                .thenReturn(CompletableFuture.completedFuture(SearchResults.builder()
                        .documents(List.of("Transformers use attention.", "Encoders and decoders."))
                        .metadata(List.of(
                                new ChunkMetadata("Intro to ML", 1, "https://example.com/ml/1"),
                                new ChunkMetadata("Intro to ML", null, null)))
                        .build()));

        ToolOutput output = tool.execute(Map.of("query", "what is a transformer", "course_name", "Intro")).join();

        assertTrue(output.isSuccess());
        assertEquals("[Intro to ML - <a href=\"https://example.com/ml/1\" target=\"_blank\" "
                + "class=\"lesson-link\">Lesson 1</a>]\nTransformers use attention.\n\n"
                + "[Intro to ML]\nEncoders and decoders.", output.getOutput());
        assertEquals(List.of("Intro to ML - Lesson 1", "Intro to ML"), output.getSources());
    }

    @Test
    void shouldUsePlainLessonLabelWithoutLink() {
        when(contentPort.search("q", null, 2)).thenReturn(CompletableFuture.completedFuture(SearchResults.builder()
                .documents(List.of("chunk"))
                .metadata(List.of(new ChunkMetadata("MCP", 2, " ")))
                .build()));

        ToolOutput output = tool.execute(Map.of("query", "q", "lesson_number", 2)).join();

        assertEquals("[MCP - Lesson 2]\nchunk", output.getOutput());
        assertEquals(List.of("MCP - Lesson 2"), output.getSources());
    }

    @Test
    void shouldFallBackToUnknownCourseTitle() {
        when(contentPort.search("q", null, null)).thenReturn(CompletableFuture.completedFuture(SearchResults.builder()
                .documents(List.of("orphan chunk"))
                .build()));

        ToolOutput output = tool.execute(Map.of("query", "q")).join();

        assertEquals("[unknown]\norphan chunk", output.getOutput());
        assertEquals(List.of("unknown"), output.getSources());
    }

    @Test
    void shouldMentionFiltersWhenNothingFound() {
        when(contentPort.search("q", "MCP", 3)).thenReturn(CompletableFuture.completedFuture(SearchResults.empty()));

        ToolOutput output = tool.execute(Map.of("query", "q", "course_name", "MCP", "lesson_number", 3)).join();

        assertTrue(output.isSuccess());
        assertEquals("No relevant content found in course 'MCP' in lesson 3.", output.getOutput());
        assertTrue(output.getSources().isEmpty());
    }

    @Test
    void shouldReportPlainEmptyMessageWithoutFilters() {
        when(contentPort.search("q", null, null)).thenReturn(CompletableFuture.completedFuture(SearchResults.empty()));

        assertEquals("No relevant content found.", tool.execute(Map.of("query", "q")).join().getOutput());
    }

    @Test
    void shouldReturnServiceErrorVerbatim() {
        when(contentPort.search("q", null, null))
                .thenReturn(CompletableFuture.completedFuture(SearchResults.error("No course found matching 'XYZ'")));

        ToolOutput output = tool.execute(Map.of("query", "q")).join();

        assertFalse(output.isSuccess());
        assertEquals("No course found matching 'XYZ'", output.text());
    }

    @Test
    void shouldRequireQuery() {
        ToolOutput output = tool.execute(Map.of("course_name", "MCP")).join();

        assertFalse(output.isSuccess());
        assertEquals("query is required", output.getError());
        verify(contentPort, never()).search(any(), any(), any());
    }

    @Test
    void shouldAcceptNumericStringLessonAndIgnoreBlankCourse() {
        when(contentPort.search("q", null, 4)).thenReturn(CompletableFuture.completedFuture(SearchResults.empty()));

        Map<String, Object> args = new HashMap<>();
        args.put("query", "q");
        args.put("course_name", "  ");
        args.put("lesson_number", "4");
        tool.execute(args).join();

        verify(contentPort).search("q", null, 4);
    }

    @Test
    void shouldRejectFractionalOrOversizedLesson() {
        ToolOutput fractional = tool.execute(Map.of("query", "q", "lesson_number", 1.5)).join();
        ToolOutput oversized = tool.execute(Map.of("query", "q", "lesson_number", 1e12)).join();
        ToolOutput tooLong = tool.execute(Map.of("query", "q", "lesson_number", 5_000_000_000L)).join();

        assertFalse(fractional.isSuccess());
        assertEquals("lesson_number must be an integer, got '1.5'", fractional.getError());
        assertFalse(oversized.isSuccess());
        assertFalse(tooLong.isSuccess());
        verify(contentPort, never()).search(any(), any(), any());
    }

    @Test
    void shouldAcceptWholeNumberDouble() {
        when(contentPort.search("q", null, 2)).thenReturn(CompletableFuture.completedFuture(SearchResults.empty()));

        tool.execute(Map.of("query", "q", "lesson_number", 2.0)).join();

        verify(contentPort).search("q", null, 2);
    }

    @Test
    void shouldCancelContentLookupWhenCancelled() {
        CompletableFuture<SearchResults> lookup = new CompletableFuture<>();
        when(contentPort.search("q", null, null)).thenReturn(lookup);

        tool.execute(Map.of("query", "q")).cancel(true);

        assertTrue(lookup.isCancelled());
    }

    @Test
    void shouldRejectNonNumericLesson() {
        ToolOutput output = tool.execute(Map.of("query", "q", "lesson_number", "two")).join();

        assertFalse(output.isSuccess());
        assertTrue(output.getError().contains("lesson_number"));
        verify(contentPort, never()).search(any(), any(), any());
    }
}
