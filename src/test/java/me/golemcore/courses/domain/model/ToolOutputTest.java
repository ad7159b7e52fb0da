package me.golemcore.courses.domain.model;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ToolOutputTest {

    @Test
    void success_createsSuccessfulOutputWithoutSources() {
        ToolOutput output = ToolOutput.success("Operation completed");

        assertTrue(output.isSuccess());
        assertEquals("Operation completed", output.text());
        assertNull(output.getError());
        assertTrue(output.getSources().isEmpty());
    }

    @Test
    void success_copiesSources() {
        List<String> sources = new ArrayList<>(List.of("MCP - Lesson 1"));
        ToolOutput output = ToolOutput.success("Done", sources);
        sources.add("later");

        assertEquals(List.of("MCP - Lesson 1"), output.getSources());
    }

    @Test
    void failure_exposesErrorAsText() {
        ToolOutput output = ToolOutput.failure("Something went wrong");

        assertFalse(output.isSuccess());
        assertEquals("Something went wrong", output.text());
        assertNull(output.getOutput());
    }

    @Test
    void text_neverBlankForFailure() {
        assertEquals("Tool execution failed", ToolOutput.failure(null).text());
        assertEquals("Tool execution failed", ToolOutput.failure("  ").text());
    }

    @Test
    void text_emptyForSuccessWithoutOutput() {
        assertEquals("", ToolOutput.success(null).text());
    }
}
