package com.sagarmitra.tools;

import java.util.Map;

/**
 * Outcome of one requested tool call. {@code content} is the tool's text output, or an
 * error text when the tool is unknown, failed or timed out.
 */
public record ToolExecutionResult(String callId, String name, Map<String, Object> args, String content) {
}
