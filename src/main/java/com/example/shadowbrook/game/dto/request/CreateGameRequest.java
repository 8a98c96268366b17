package com.example.shadowbrook.game.dto.request;

import java.util.Map;

import com.example.shadowbrook.game.domain.PlayerRole;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record CreateGameRequest(
        @NotBlank @Size(max = 50) String name,
        @Min(4) @Max(20) Integer maxPlayers,
        Map<PlayerRole, Integer> roleDistribution) {
}
