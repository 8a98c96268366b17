package com.example.shadowbrook.game.dto.request;

import jakarta.validation.constraints.NotBlank;

public record TransferHostRequest(String playerId, @NotBlank String newHostId) {
}
