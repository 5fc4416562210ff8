package com.sagarmitra.tools;

public record ToolResult(String tool, String content) {
}
