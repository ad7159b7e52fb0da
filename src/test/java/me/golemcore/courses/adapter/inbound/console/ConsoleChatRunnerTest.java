package me.golemcore.courses.adapter.inbound.console;

import me.golemcore.courses.domain.model.CourseAnalytics;
import me.golemcore.courses.domain.model.QueryAnswer;
import me.golemcore.courses.domain.service.CourseQueryService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringReader;
import java.io.StringWriter;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.*;

class ConsoleChatRunnerTest {

    @Mock
    private CourseQueryService queryService;

    private ConsoleChatRunner runner;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        runner = new ConsoleChatRunner(queryService);
    }

    @Test
    void shouldPrintAnswerWithSourcesAndReuseSession() throws IOException {
        when(queryService.query(eq("What is MCP?"), isNull()))
                .thenReturn(new QueryAnswer("MCP is a protocol.", List.of("MCP - Lesson 1"), "session_1"));
        when(queryService.query(eq("Who teaches it?"), eq("session_1")))
                .thenReturn(new QueryAnswer("Jane Doe.", List.of(), "session_1"));

        String output = chat("What is MCP?\nWho teaches it?\n/quit\n");

        assertTrue(output.contains("MCP is a protocol."));
        assertTrue(output.contains("Sources:\n- MCP - Lesson 1"));
        assertTrue(output.contains("Jane Doe."));
        verify(queryService).query("Who teaches it?", "session_1");
    }

    @Test
    void shouldListCourses() throws IOException {
        when(queryService.courseAnalytics()).thenReturn(new CourseAnalytics(2, List.of("Intro to ML", "MCP")));

        String output = chat("/courses\n");

        assertTrue(output.contains("Courses: 2\n- Intro to ML\n- MCP"));
        verify(queryService, never()).query(any(), any());
    }

    @Test
    void shouldClearSessionOnReset() throws IOException {
        when(queryService.query(any(), any())).thenReturn(new QueryAnswer("a", List.of(), "session_7"));

        chat("hello\n/reset\nagain\n");

        verify(queryService).clearSession("session_7");
        verify(queryService, times(2)).query(any(), isNull());
    }

    @Test
    void shouldIgnoreBlankLinesAndStopAtEndOfInput() throws IOException {
        String output = chat("\n   \n");

        assertTrue(output.startsWith("Ask a question about the courses"));
        verifyNoInteractions(queryService);
    }

    private String chat(String input) throws IOException {
        StringWriter buffer = new StringWriter();
        runner.chat(new BufferedReader(new StringReader(input)), new PrintWriter(buffer, true));
        return buffer.toString().replace(System.lineSeparator(), "\n");
    }
}
