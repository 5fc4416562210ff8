package com.sagarmitra.service.impl.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * @param language per-message language override; the conversation's language is used when absent
 */
public record SendMessageRequest(@NotBlank @Size(max = 4000) String message, @Size(max = 16) String language) {
}
