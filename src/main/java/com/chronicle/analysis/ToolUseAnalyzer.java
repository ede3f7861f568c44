package com.chronicle.analysis;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.chronicle.util.Jsons;

/**
 * Derived facts about a tool call: MCP server/tool split, input size and the shape of the result.
 */
public class ToolUseAnalyzer {

    static final long LARGE_RESULT_BYTES = 100_000;

    private static final Pattern MCP_TOOL = Pattern.compile("^mcp__(.+?)__(.+)$");

    private final DataSanitizer sanitizer;

    public ToolUseAnalyzer(DataSanitizer sanitizer) {
        this.sanitizer = sanitizer;
    }

    /**
     * Server and tool name of an MCP tool such as {@code mcp__github__create_issue}.
     */
    public static Optional<String[]> parseMcpTool(String toolName) {
        if (toolName == null) {
            return Optional.empty();
        }
        Matcher matcher = MCP_TOOL.matcher(toolName);
        if (!matcher.matches()) {
            return Optional.empty();
        }
        return Optional.of(new String[] {matcher.group(1), matcher.group(2)});
    }

    public Map<String, Object> describeInput(String toolName, Map<String, Object> toolInput) {
        Map<String, Object> info = new LinkedHashMap<>();
        addMcpInfo(info, toolName);
        info.put("param_count", toolInput != null ? toolInput.size() : 0);
        info.put("input_size", sizeOf(toolInput));
        List<String> sensitive = sanitizer.sensitiveParameterTypes(toolInput);
        if (!sensitive.isEmpty()) {
            info.put("sensitive_params", sensitive);
        }
        return info;
    }

    @SuppressWarnings("unchecked")
    public Map<String, Object> describeResult(String toolName, Object toolResult) {
        Map<String, Object> info = new LinkedHashMap<>();
        addMcpInfo(info, toolName);
        long size = sizeOf(toolResult);
        info.put("result_size", size);
        info.put("large_result", size > LARGE_RESULT_BYTES);

        boolean success = true;
        String error = null;
        if (toolResult instanceof Map) {
            Map<String, Object> result = (Map<String, Object>) toolResult;
            Object err = result.get("error");
            if (err != null && !Boolean.FALSE.equals(err)) {
                success = false;
                error = String.valueOf(err);
            } else if (Boolean.FALSE.equals(result.get("success"))) {
                success = false;
            } else if (Boolean.TRUE.equals(result.get("is_error")) || Boolean.TRUE.equals(result.get("isError"))) {
                success = false;
            }
        }
        info.put("success", success);
        if (error != null) {
            info.put("error", sanitizer.sanitizeText(DataSanitizer.truncate(error, 500)));
        }
        return info;
    }

    private static void addMcpInfo(Map<String, Object> info, String toolName) {
        parseMcpTool(toolName).ifPresentOrElse(parts -> {
            info.put("is_mcp_tool", true);
            info.put("mcp_server", parts[0]);
            info.put("mcp_tool", parts[1]);
        }, () -> info.put("is_mcp_tool", false));
    }

    private static long sizeOf(Object value) {
        if (value == null) {
            return 0;
        }
        if (value instanceof String) {
            return ((String) value).getBytes(StandardCharsets.UTF_8).length;
        }
        return Jsons.toJson(value).getBytes(StandardCharsets.UTF_8).length;
    }
}
