package com.sagarmitra.service.impl.dto;

import java.util.LinkedHashMap;
import java.util.Map;

public record ToolCallSummary(String name, Map<String, Object> args) {

    public static ToolCallSummary of(ToolCall call) {
        return new ToolCallSummary(call.name(), call.arguments());
    }

    public Map<String, Object> toRecord() {
        Map<String, Object> record = new LinkedHashMap<>();
        record.put("name", name);
        record.put("args", args);
        return record;
    }
}
