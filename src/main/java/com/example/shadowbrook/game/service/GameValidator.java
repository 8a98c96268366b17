package com.example.shadowbrook.game.service;

import java.util.Map;

import com.example.shadowbrook.game.domain.Game;
import com.example.shadowbrook.game.domain.GamePhase;
import com.example.shadowbrook.game.domain.GamePlayer;
import com.example.shadowbrook.game.domain.NightActionType;
import com.example.shadowbrook.game.domain.PlayerRole;
import com.example.shadowbrook.game.domain.Players;
import com.example.shadowbrook.global.error.ErrorCode;
import org.springframework.stereotype.Component;

/**
 * 상태 변경 전 선행 조건 검사. 모든 검사는 첫 저장 이전에 끝나야 합니다.
 */
@Component
public class GameValidator {

    static final int MIN_PLAYERS = 4;
    static final int MAX_PLAYERS = 20;

    public void validateHost(Game game, String requesterId) {
        // 요청자 ID 가 없으면 검사하지 않음
        if (requesterId != null && !requesterId.equals(game.getHostId())) {
            throw ErrorCode.NOT_HOST.commonException();
        }
    }

    public void validateNotEnded(Game game) {
        if (game.getCurrentPhase() == GamePhase.ENDED) {
            throw ErrorCode.GAME_ALREADY_ENDED.commonException();
        }
    }

    public void validatePhase(Game game, GamePhase expected) {
        validateNotEnded(game);
        if (game.getCurrentPhase() != expected) {
            throw ErrorCode.WRONG_PHASE.commonException(
                    "Only allowed during " + expected + " (current: " + game.getCurrentPhase() + ")");
        }
    }

    public void validateJoinable(Game game, int currentPlayers) {
        if (game.getCurrentPhase() != GamePhase.LOBBY || !game.isActive()) {
            throw ErrorCode.GAME_NOT_JOINABLE.commonException();
        }
        if (currentPlayers >= game.getMaxPlayers()) {
            throw ErrorCode.GAME_FULL.commonException();
        }
    }

    public void validateStartable(Game game, Players players) {
        validatePhase(game, GamePhase.LOBBY);
        if (players.size() < MIN_PLAYERS) {
            throw ErrorCode.NOT_ENOUGH_PLAYERS.commonException();
        }
        if (!players.allReady()) {
            throw ErrorCode.PLAYERS_NOT_READY.commonException();
        }
    }

    public void validateAdvance(Game game) {
        validateNotEnded(game);
        if (game.getCurrentPhase() == GamePhase.LOBBY) {
            throw ErrorCode.WRONG_PHASE.commonException("Use start to leave the lobby");
        }
    }

    public GamePlayer validateVote(Game game, Players players, String voterId, String targetId) {
        validatePhase(game, GamePhase.VOTING);
        GamePlayer voter = requireAlive(players, voterId);
        validateTarget(players, voter, targetId);
        return voter;
    }

    public GamePlayer validateAction(Game game, Players players, String actorId, NightActionType action,
            String targetId) {
        validatePhase(game, GamePhase.NIGHT);
        GamePlayer actor = requireAlive(players, actorId);
        if (actor.getRole() == null || !actor.getRole().canPerform(action)) {
            throw ErrorCode.INVALID_ACTION_FOR_ROLE.commonException();
        }
        GamePlayer target = validateTarget(players, actor, targetId);
        if (actor.isMafia() && target.isMafia()) {
            throw ErrorCode.INVALID_TARGET.commonException("Mafia cannot target another mafia member");
        }
        return actor;
    }

    /**
     * 이름/정원/역할 분배 설정 검사. 정원은 현재 인원과 분배 합계 이상이어야 합니다.
     */
    public void validateSettings(String name, int maxPlayers, int currentPlayers,
            Map<PlayerRole, Integer> distribution) {
        if (name != null && name.isBlank()) {
            throw ErrorCode.INVALID_SETTINGS.commonException("Game name must not be blank");
        }
        if (maxPlayers < MIN_PLAYERS || maxPlayers > MAX_PLAYERS) {
            throw ErrorCode.INVALID_SETTINGS.commonException(
                    "maxPlayers must be between " + MIN_PLAYERS + " and " + MAX_PLAYERS);
        }
        if (maxPlayers < currentPlayers) {
            throw ErrorCode.INVALID_SETTINGS.commonException("maxPlayers is below the current player count");
        }
        if (distribution != null) {
            boolean negative = distribution.values().stream().anyMatch(count -> count == null || count < 0);
            if (negative || RoleAssigner.sum(distribution) > maxPlayers) {
                throw ErrorCode.INVALID_SETTINGS.commonException("Role distribution exceeds maxPlayers");
            }
        }
    }

    private GamePlayer requireAlive(Players players, String playerId) {
        GamePlayer player = players.findById(playerId)
                .orElseThrow(ErrorCode.PLAYER_NOT_FOUND::commonException);
        if (!player.isAlive()) {
            throw ErrorCode.PLAYER_NOT_ALIVE.commonException();
        }
        return player;
    }

    private GamePlayer validateTarget(Players players, GamePlayer actor, String targetId) {
        GamePlayer target = players.findById(targetId)
                .orElseThrow(() -> ErrorCode.INVALID_TARGET.commonException("Target is not in this game"));
        if (!target.isAlive()) {
            throw ErrorCode.INVALID_TARGET.commonException("Target is not alive");
        }
        if (target.getId().equals(actor.getId())) {
            throw ErrorCode.INVALID_TARGET.commonException("Cannot target yourself");
        }
        return target;
    }
}
