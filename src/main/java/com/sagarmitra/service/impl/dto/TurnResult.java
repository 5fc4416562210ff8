package com.sagarmitra.service.impl.dto;

import lombok.Builder;
import lombok.Data;

import java.util.List;

@Data
@Builder
public class TurnResult {
    private String responseText;
    private boolean languageRejected;
    private List<ToolCallSummary> toolCallsUsed;
    private String messageId;
}
