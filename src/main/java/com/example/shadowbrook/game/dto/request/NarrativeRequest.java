package com.example.shadowbrook.game.dto.request;

import jakarta.validation.constraints.Size;

public record NarrativeRequest(String playerId, @Size(max = 500) String prompt) {
}
