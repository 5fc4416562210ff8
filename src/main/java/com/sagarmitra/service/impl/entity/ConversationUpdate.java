package com.sagarmitra.service.impl.entity;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * Fields to overwrite on a conversation record. Null fields are left untouched;
 * the updated timestamp is always refreshed.
 */
@Getter
@Builder
@ToString
public class ConversationUpdate {
    private final String title;
    private final String language;
    private final String summary;
    private final Integer messageCount;

    public boolean isEmpty() {
        return title == null && language == null && summary == null && messageCount == null;
    }
}
