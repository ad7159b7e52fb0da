package me.golemcore.courses.domain.service;

import me.golemcore.courses.domain.component.ToolComponent;
import me.golemcore.courses.domain.model.CourseAnalytics;
import me.golemcore.courses.domain.model.QueryAnswer;
import me.golemcore.courses.domain.model.ToolDefinition;
import me.golemcore.courses.domain.model.ToolOutput;
import me.golemcore.courses.domain.system.toolloop.ToolLoopState;
import me.golemcore.courses.domain.system.toolloop.ToolLoopSystem;
import me.golemcore.courses.domain.system.toolloop.ToolLoopTurnResult;
import me.golemcore.courses.infrastructure.config.CourseAssistantProperties;
import me.golemcore.courses.port.outbound.CourseContentPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.*;

class CourseQueryServiceTest {

    private ToolLoopSystem toolLoopSystem;
    private ToolRegistry registry;
    private SessionService sessionService;
    private CourseContentPort contentPort;
    private CourseQueryService service;

    @BeforeEach
    void setUp() {
        toolLoopSystem = mock(ToolLoopSystem.class);
        registry = new ToolRegistry(5, Clock.systemUTC());
        registry.register(new SourcedTool());
        sessionService = new SessionService(new CourseAssistantProperties());
        contentPort = mock(CourseContentPort.class);
        service = new CourseQueryService(toolLoopSystem, registry, sessionService, contentPort);
    }

    @Test
    void shouldPrefixPromptAndCreateSessionWhenMissing() {
        when(toolLoopSystem.respond(any(), any(), anyList(), any())).thenReturn("Attention weighs tokens.");

        QueryAnswer answer = service.query("What is attention?", null);

        verify(toolLoopSystem).respond(eq("Answer this question about course materials: What is attention?"),
                isNull(), anyList(), eq(registry));
        assertEquals("Attention weighs tokens.", answer.answer());
        assertEquals("session_1", answer.sessionId());
        assertTrue(answer.sources().isEmpty());
    }

    @Test
    void shouldStoreRawQueryAndFeedHistoryIntoNextTurn() {
        when(toolLoopSystem.respond(any(), any(), anyList(), any())).thenReturn("first answer", "second answer");

        String sessionId = service.query("first question", null).sessionId();
        service.query("second question", sessionId);

        ArgumentCaptor<String> history = ArgumentCaptor.forClass(String.class);
        verify(toolLoopSystem, times(2)).respond(any(), history.capture(), anyList(), any());
        assertNull(history.getAllValues().get(0));
        assertEquals("User: first question\nAssistant: first answer", history.getAllValues().get(1));
    }

    @Test
    void shouldReturnSourcesGatheredDuringTheTurnOnly() {
        when(toolLoopSystem.respond(any(), any(), anyList(), any())).thenAnswer(invocation -> {
            String prompt = invocation.getArgument(0);
            if (prompt.endsWith("q1")) {
                ToolRegistry used = invocation.getArgument(3);
                used.execute(SourcedTool.NAME, Map.of("query", "x"));
            }
            return "answer";
        });

        QueryAnswer first = service.query("q1", null);
        QueryAnswer second = service.query("q2", first.sessionId());

        assertEquals(List.of("Intro to ML - Lesson 1"), first.sources());
        assertTrue(second.sources().isEmpty());
        assertTrue(registry.callHistory().isEmpty());
    }

    @Test
    void shouldAdvertiseRegisteredTools() {
        when(toolLoopSystem.respond(any(), any(), anyList(), any())).thenReturn("ok");

        service.query("q", "s");

        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<ToolDefinition>> tools = ArgumentCaptor.forClass(List.class);
        verify(toolLoopSystem).respond(any(), any(), tools.capture(), any());
        assertEquals(SourcedTool.NAME, tools.getValue().get(0).getName());
    }

    @Test
    void shouldReturnAnalyticsFromContentService() {
        when(contentPort.analytics()).thenReturn(
                CompletableFuture.completedFuture(new CourseAnalytics(2, List.of("Intro to ML", "MCP"))));

        CourseAnalytics analytics = service.courseAnalytics();

        assertEquals(2, analytics.totalCourses());
        assertEquals(List.of("Intro to ML", "MCP"), analytics.courseTitles());
    }

    @Test
    void shouldDegradeAnalyticsWhenContentServiceFails() {
        when(contentPort.analytics()).thenReturn(
                CompletableFuture.failedFuture(new UncheckedIOException(new IOException("connection refused"))));

        CourseAnalytics analytics = service.courseAnalytics();

        assertEquals(0, analytics.totalCourses());
        assertTrue(analytics.courseTitles().isEmpty());
    }

    @Test
    void shouldClearSessionHistory() {
        when(toolLoopSystem.respond(any(), any(), anyList(), any())).thenReturn("a");
        String sessionId = service.query("q", null).sessionId();

        service.clearSession(sessionId);

        assertNull(sessionService.getConversationHistory(sessionId));
    }

    @Test
    void shouldUseTurnResultTextThroughDefaultRespond() {
        ToolLoopSystem system = mock(ToolLoopSystem.class, CALLS_REAL_METHODS);
        doReturn(new ToolLoopTurnResult("from process", ToolLoopState.DONE, 0, 1, 0))
                .when(system).process(any(), any(), anyList(), any());
        CourseQueryService viaProcess = new CourseQueryService(system, registry, sessionService, contentPort);

        assertEquals("from process", viaProcess.query("q", null).answer());
    }

    private static class SourcedTool implements ToolComponent {
        static final String NAME = "search_course_content";

        @Override
        public ToolDefinition getDefinition() {
            return ToolDefinition.builder().name(NAME).description("search").build();
        }

        @Override
        public CompletableFuture<ToolOutput> execute(Map<String, Object> parameters) {
            return CompletableFuture.completedFuture(ToolOutput.success("chunk", List.of("Intro to ML - Lesson 1")));
        }
    }
}
