package com.example.shadowbrook.game.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record JoinGameRequest(@NotBlank @Size(max = 30) String name) {
}
