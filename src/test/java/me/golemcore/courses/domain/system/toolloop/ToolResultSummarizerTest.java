package me.golemcore.courses.domain.system.toolloop;

import me.golemcore.courses.domain.model.ToolResult;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ToolResultSummarizerTest {

    private final ToolResultSummarizer summarizer = new ToolResultSummarizer(3);

    @Test
    void joinsFirstThreeSuccessfulResults() {
        List<ToolResult> results = List.of(ok("one"), failed("Search error: down"), ok("two"), ok("three"),
                ok("four"));

        assertEquals("one\n\ntwo\n\nthree", summarizer.summarize(results));
    }

    @Test
    void reportsWhenNoResultSucceeded() {
        assertEquals("No search results were successfully retrieved.", summarizer.summarize(List.of()));
        assertEquals("No search results were successfully retrieved.",
                summarizer.summarize(List.of(failed("Tool 'x' not found"))));
    }

    @Test
    void skipsBlankResults() {
        assertEquals("real", summarizer.summarize(List.of(ok(" "), ok("real"))));
    }

    @Test
    void wrapsSummaryInTemplates() {
        List<ToolResult> results = List.of(ok("found"));

        assertEquals("I encountered an error during my search, but here's what I found: found",
                summarizer.afterTransportFailure(results));
        assertEquals("Reached maximum search rounds. Based on my searches: found",
                summarizer.afterRoundLimit(results));
        assertEquals("The conversation grew too long to continue searching. Based on my searches: found",
                summarizer.afterSizeLimit(results));
    }

    @Test
    void honoursConfiguredCap() {
        ToolResultSummarizer single = new ToolResultSummarizer(1);

        assertEquals("one", single.summarize(List.of(ok("one"), ok("two"))));
    }

    private static ToolResult ok(String content) {
        return ToolResult.builder().toolCallId("c").toolName("t").content(content).success(true).build();
    }

    private static ToolResult failed(String content) {
        return ToolResult.builder().toolCallId("c").toolName("t").content(content).success(false).build();
    }
}
