package com.example.shadowbrook.game.domain;

import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * 게임 세션. 방 코드로 공개 조회되고, 내부 식별자로 상태가 변경됩니다.
 */
@Getter
@Setter
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Game {

    private String id;
    private String roomCode;
    private String name;
    private String hostId;

    @Builder.Default
    private int maxPlayers = 8;

    @Builder.Default
    private GamePhase currentPhase = GamePhase.LOBBY;

    @Builder.Default
    private int dayNumber = 1;

    @Builder.Default
    private int timeRemaining = 300;

    @Builder.Default
    private boolean active = true;

    @Builder.Default
    private String narrative = "";

    @Builder.Default
    private List<String> gameLog = new ArrayList<>();

    // null 이면 시작 시점의 인원수로 기본 분배를 계산
    private Map<PlayerRole, Integer> roleDistribution;

    private Team winner;

    private Instant createdAt;
    private Instant updatedAt;

    public Game copy() {
        return toBuilder()
                .gameLog(gameLog == null ? new ArrayList<>() : new ArrayList<>(gameLog))
                .roleDistribution(copyDistribution(roleDistribution))
                .build();
    }

    public static Map<PlayerRole, Integer> copyDistribution(Map<PlayerRole, Integer> distribution) {
        if (distribution == null) {
            return null;
        }
        Map<PlayerRole, Integer> copy = new EnumMap<>(PlayerRole.class);
        copy.putAll(distribution);
        return copy;
    }
}
