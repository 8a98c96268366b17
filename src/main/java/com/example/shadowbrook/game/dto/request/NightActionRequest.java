package com.example.shadowbrook.game.dto.request;

import com.example.shadowbrook.game.domain.NightActionType;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

public record NightActionRequest(
        @NotBlank String playerId,
        @NotNull NightActionType action,
        @NotBlank String targetId) {
}
