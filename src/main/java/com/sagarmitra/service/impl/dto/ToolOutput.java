package com.sagarmitra.service.impl.dto;

import java.util.LinkedHashMap;
import java.util.Map;

/** Observability record of one tool execution; {@code result} is truncated. */
public record ToolOutput(String tool, Map<String, Object> args, String result) {

    public Map<String, Object> toRecord() {
        Map<String, Object> record = new LinkedHashMap<>();
        record.put("tool", tool);
        record.put("args", args);
        record.put("result", result);
        return record;
    }
}
