package com.example.shadowbrook.game.dto.request;

import jakarta.validation.constraints.NotBlank;

public record VoteRequest(@NotBlank String playerId, @NotBlank String targetId) {
}
