package com.sagarmitra.service.impl.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ConversationEntity {
    public static final String DEFAULT_TITLE = "New Chat";

    private String conversationId;
    private String userId;
    private String title;
    private String language;
    /** Rolling summary of messages older than the short-term window; null until first generated. */
    private String summary;
    private int messageCount;
    private Instant createdAt;
    private Instant updatedAt;
}
