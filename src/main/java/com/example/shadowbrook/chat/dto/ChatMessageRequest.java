package com.example.shadowbrook.chat.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record ChatMessageRequest(
        String playerId,
        @NotBlank @Size(max = 500) String message,
        boolean systemMessage) {
}
