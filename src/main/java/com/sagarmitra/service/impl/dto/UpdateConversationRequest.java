package com.sagarmitra.service.impl.dto;

import jakarta.validation.constraints.Size;

public record UpdateConversationRequest(@Size(max = 255) String title, @Size(max = 16) String language) {
}
