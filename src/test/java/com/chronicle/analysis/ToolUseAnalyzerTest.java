package com.chronicle.analysis;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Map;

import org.junit.jupiter.api.Test;

class ToolUseAnalyzerTest {

    private final ToolUseAnalyzer analyzer = new ToolUseAnalyzer(new DataSanitizer(10_000));

    @Test
    void testParseMcpTool() {
        String[] parts = ToolUseAnalyzer.parseMcpTool("mcp__github__create_issue").orElseThrow();

        assertArrayEquals(new String[] {"github", "create_issue"}, parts);
        assertTrue(ToolUseAnalyzer.parseMcpTool("Read").isEmpty());
        assertTrue(ToolUseAnalyzer.parseMcpTool(null).isEmpty());
    }

    @Test
    void testDescribeInput() {
        Map<String, Object> info = analyzer.describeInput("mcp__db__query",
                Map.of("sql", "select 1", "password", "pw"));

        assertEquals(true, info.get("is_mcp_tool"));
        assertEquals("db", info.get("mcp_server"));
        assertEquals("query", info.get("mcp_tool"));
        assertEquals(2, info.get("param_count"));
        assertTrue((Long) info.get("input_size") > 0);
        assertNotNull(info.get("sensitive_params"));
    }

    @Test
    void testDescribeResult() {
        Map<String, Object> ok = analyzer.describeResult("Bash", Map.of("stdout", "done"));
        Map<String, Object> failed = analyzer.describeResult("Bash", Map.of("error", "command not found"));
        Map<String, Object> flagged = analyzer.describeResult("Edit", Map.of("is_error", true));

        assertEquals(true, ok.get("success"));
        assertEquals(false, ok.get("large_result"));
        assertEquals(false, failed.get("success"));
        assertEquals("command not found", failed.get("error"));
        assertEquals(false, flagged.get("success"));
        assertEquals(0L, analyzer.describeResult("Read", null).get("result_size"));
    }

    @Test
    void testLargeResult() {
        Map<String, Object> info = analyzer.describeResult("Read", "y".repeat((int) ToolUseAnalyzer.LARGE_RESULT_BYTES + 1));

        assertEquals(true, info.get("large_result"));
    }
}
