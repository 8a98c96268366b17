package com.example.shadowbrook.global.socket;

import java.util.Map;

import com.example.shadowbrook.game.domain.GameState;
import com.example.shadowbrook.game.domain.PlayerRole;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * 클라이언트로 나가는 실시간 메시지.
 * playerId 는 개인 메시지의 수신자 또는 이벤트의 주체입니다.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record GameEvent(
        EventType type,
        Object payload,
        String gameId,
        String playerId) {

    public static GameEvent gameUpdate(GameState state) {
        return new GameEvent(EventType.GAME_UPDATE, state, state.game().getId(), null);
    }

    public static GameEvent phaseChange(GameState state) {
        return new GameEvent(EventType.PHASE_CHANGE, state, state.game().getId(), null);
    }

    public static GameEvent voteCast(GameState state) {
        return new GameEvent(EventType.VOTE_CAST, state, state.game().getId(), null);
    }

    public static GameEvent playerJoined(String gameId, Object player) {
        return new GameEvent(EventType.PLAYER_JOINED, player, gameId, null);
    }

    public static GameEvent playerLeft(String gameId, String playerId) {
        return new GameEvent(EventType.PLAYER_LEFT, Map.of("playerId", playerId), gameId, null);
    }

    public static GameEvent chatMessage(String gameId, Object message) {
        return new GameEvent(EventType.CHAT_MESSAGE, message, gameId, null);
    }

    public static GameEvent roleReveal(String gameId, String playerId, PlayerRole role) {
        return new GameEvent(EventType.ROLE_REVEAL,
                Map.of("role", role, "description", role.getDescription()), gameId, playerId);
    }

    public static GameEvent actionTaken(String gameId, String playerId) {
        // 행동 종류는 공개하지 않음
        return new GameEvent(EventType.ACTION_TAKEN,
                Map.of("playerId", playerId, "action", "ACTION_TAKEN"), gameId, null);
    }

    public static GameEvent investigationResult(String gameId, String detectiveId, String targetId,
            String targetName, PlayerRole role) {
        return new GameEvent(EventType.INVESTIGATION_RESULT,
                Map.of("targetId", targetId, "targetName", targetName, "role", role), gameId, detectiveId);
    }

    public static GameEvent timerUpdate(String gameId, int timeRemaining, Object phase, int dayNumber) {
        return new GameEvent(EventType.TIMER_UPDATE,
                Map.of("timeRemaining", timeRemaining, "phase", phase, "dayNumber", dayNumber), gameId, null);
    }

    public static GameEvent error(String message) {
        return new GameEvent(EventType.ERROR, Map.of("message", message), null, null);
    }
}
