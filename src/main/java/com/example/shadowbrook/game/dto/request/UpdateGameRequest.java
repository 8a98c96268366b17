package com.example.shadowbrook.game.dto.request;

import java.util.Map;

import com.example.shadowbrook.game.domain.PlayerRole;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Size;

/**
 * 대기실 설정 변경. null 인 필드는 유지됩니다.
 */
public record UpdateGameRequest(
        String playerId,
        @Size(max = 50) String name,
        @Min(4) @Max(20) Integer maxPlayers,
        Map<PlayerRole, Integer> roleDistribution) {
}
