package com.sagarmitra.service.impl.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * One entry of a conversation's append-only log. {@code messageKey} is the ordering key
 * within the conversation (see {@link com.sagarmitra.service.impl.MessageKeyGenerator}).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MessageEntity {
    private String conversationId;
    private String messageKey;
    private String messageId;
    private String role;
    private String content;
    private List<Map<String, Object>> toolCalls;
    private Map<String, Object> metadata;
}
