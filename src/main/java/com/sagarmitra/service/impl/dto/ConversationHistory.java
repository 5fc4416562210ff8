package com.sagarmitra.service.impl.dto;

import com.sagarmitra.service.impl.entity.MessageEntity;

import java.util.List;

public record ConversationHistory(List<MessageEntity> messages, String summary) {
}
