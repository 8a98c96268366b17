package com.example.shadowbrook.game.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import com.example.shadowbrook.game.domain.Game;
import com.example.shadowbrook.game.domain.GamePhase;
import com.example.shadowbrook.game.domain.GamePlayer;
import com.example.shadowbrook.game.domain.GameState;
import com.example.shadowbrook.game.domain.NightActionType;
import com.example.shadowbrook.game.domain.PlayerRole;
import com.example.shadowbrook.game.domain.PlayerStatus;
import com.example.shadowbrook.game.domain.Team;
import com.example.shadowbrook.game.repository.GameStore;
import com.example.shadowbrook.global.error.CommonException;
import com.example.shadowbrook.global.error.ErrorCode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

@SpringBootTest
class GameServiceTest {

    @Autowired
    private GameService gameService;

    @Autowired
    private GameStore gameStore;

    // ==================== 헬퍼 메소드 ====================

    private Game lobbyWithPlayers(int count, Map<PlayerRole, Integer> distribution) {
        Game game = gameService.createGame("Shadowbrook", Math.max(8, count), distribution);
        IntStream.range(0, count).forEach(i -> gameService.joinGame(game.getId(), "player" + i));
        return game;
    }

    private Game startedGame(int count, Map<PlayerRole, Integer> distribution) {
        Game game = lobbyWithPlayers(count, distribution);
        gameStore.findPlayersByGame(game.getId())
                .forEach(player -> gameService.updatePlayer(player.getId(), null, true));
        return gameService.startGame(game.getId(), null);
    }

    private List<GamePlayer> playersOf(Game game) {
        return gameStore.findPlayersByGame(game.getId());
    }

    private GamePlayer first(Game game, Predicate<GamePlayer> condition) {
        return playersOf(game).stream().filter(condition).findFirst().orElseThrow();
    }

    private GamePlayer withRole(Game game, PlayerRole role) {
        return first(game, player -> player.getRole() == role);
    }

    private static ErrorCode errorCodeOf(Throwable throwable) {
        return ((CommonException) throwable).getErrorCode();
    }

    // ==================== 시작 ====================

    @Test
    @DisplayName("4명이 모두 준비하면 시작되고 기본 분배로 역할이 한 명씩 배정된다")
    void startWithFourPlayers() {
        // when
        Game game = startedGame(4, null);

        // then
        assertThat(game.getCurrentPhase()).isEqualTo(GamePhase.DAY);
        assertThat(game.getDayNumber()).isEqualTo(1);
        assertThat(game.getTimeRemaining()).isEqualTo(GameService.PHASE_DURATION_SECONDS);
        assertThat(game.getGameLog()).startsWith("Game started with 4 players", NarrativeService.OPENING_NARRATIVE);
        assertThat(game.getNarrative()).isEqualTo(NarrativeService.OPENING_NARRATIVE);

        Map<PlayerRole, Long> roles = playersOf(game).stream()
                .collect(Collectors.groupingBy(GamePlayer::getRole, Collectors.counting()));
        assertThat(roles).containsOnly(
                Map.entry(PlayerRole.MAFIA, 1L),
                Map.entry(PlayerRole.DOCTOR, 1L),
                Map.entry(PlayerRole.DETECTIVE, 1L),
                Map.entry(PlayerRole.VILLAGER, 1L));
    }

    @Test
    @DisplayName("3명이면 시작할 수 없다")
    void startRequiresFourPlayers() {
        Game game = lobbyWithPlayers(3, null);
        playersOf(game).forEach(player -> gameService.updatePlayer(player.getId(), null, true));

        assertThatThrownBy(() -> gameService.startGame(game.getId(), null))
                .isInstanceOf(CommonException.class)
                .satisfies(e -> assertThat(errorCodeOf(e)).isEqualTo(ErrorCode.NOT_ENOUGH_PLAYERS));
    }

    @Test
    @DisplayName("준비하지 않은 플레이어가 있으면 시작할 수 없다")
    void startRequiresEveryoneReady() {
        Game game = lobbyWithPlayers(4, null);

        assertThatThrownBy(() -> gameService.startGame(game.getId(), null))
                .isInstanceOf(CommonException.class)
                .satisfies(e -> assertThat(errorCodeOf(e)).isEqualTo(ErrorCode.PLAYERS_NOT_READY));
        assertThat(gameService.getGame(game.getId()).getCurrentPhase()).isEqualTo(GamePhase.LOBBY);
    }

    @Test
    @DisplayName("호스트가 아닌 플레이어는 게임을 시작할 수 없다")
    void onlyHostCanStart() {
        Game game = lobbyWithPlayers(4, null);
        playersOf(game).forEach(player -> gameService.updatePlayer(player.getId(), null, true));
        GamePlayer guest = first(game, player -> !player.isHost());

        assertThatThrownBy(() -> gameService.startGame(game.getId(), guest.getId()))
                .isInstanceOf(CommonException.class)
                .satisfies(e -> assertThat(errorCodeOf(e)).isEqualTo(ErrorCode.NOT_HOST));
    }

    // ==================== 참가 ====================

    @Test
    @DisplayName("첫 참가자가 호스트가 되고 정원이 차면 참가할 수 없다")
    void joinAssignsHostAndRespectsCapacity() {
        // given
        Game game = gameService.createGame("Small", 4, null);
        GamePlayer first = gameService.joinGame(game.getId(), "first");
        IntStream.range(0, 3).forEach(i -> gameService.joinGame(game.getId(), "guest" + i));

        // then
        assertThat(first.isHost()).isTrue();
        assertThat(gameService.getGame(game.getId()).getHostId()).isEqualTo(first.getId());
        assertThat(playersOf(game)).filteredOn(GamePlayer::isHost).hasSize(1);
        assertThatThrownBy(() -> gameService.joinGame(game.getId(), "late"))
                .isInstanceOf(CommonException.class)
                .satisfies(e -> assertThat(errorCodeOf(e)).isEqualTo(ErrorCode.GAME_FULL));
    }

    @Test
    @DisplayName("게임이 시작된 뒤에는 참가할 수 없다")
    void joinOnlyInLobby() {
        Game game = startedGame(4, null);

        assertThatThrownBy(() -> gameService.joinGame(game.getId(), "late"))
                .isInstanceOf(CommonException.class)
                .satisfies(e -> assertThat(errorCodeOf(e)).isEqualTo(ErrorCode.GAME_NOT_JOINABLE));
    }

    @Test
    @DisplayName("없는 게임은 NOT_FOUND")
    void unknownGame() {
        assertThatThrownBy(() -> gameService.joinGame("missing", "someone"))
                .isInstanceOf(CommonException.class)
                .satisfies(e -> assertThat(errorCodeOf(e)).isEqualTo(ErrorCode.GAME_NOT_FOUND));
    }

    // ==================== 투표 ====================

    @Test
    @DisplayName("재투표하면 이전 대상의 표가 빠지고 새 대상의 표가 늘어난다")
    void reVoteMovesBallot() {
        // given
        Game game = startedGame(5, null);
        gameService.advancePhase(game.getId(), null);
        List<GamePlayer> players = playersOf(game);
        GamePlayer voter = players.get(0);
        GamePlayer firstTarget = players.get(1);
        GamePlayer secondTarget = players.get(2);

        // when
        gameService.castVote(game.getId(), voter.getId(), firstTarget.getId());
        gameService.castVote(game.getId(), voter.getId(), secondTarget.getId());

        // then
        assertThat(gameStore.findPlayer(firstTarget.getId()).orElseThrow().getVotes()).isZero();
        assertThat(gameStore.findPlayer(secondTarget.getId()).orElseThrow().getVotes()).isEqualTo(1);
        assertThat(gameStore.findPlayer(voter.getId()).orElseThrow().getVotedFor()).isEqualTo(secondTarget.getId());
    }

    @Test
    @DisplayName("투표 단계가 아니거나 자기 자신에게는 투표할 수 없다")
    void voteGuards() {
        Game game = startedGame(4, null);
        List<GamePlayer> players = playersOf(game);

        assertThatThrownBy(() -> gameService.castVote(game.getId(), players.get(0).getId(), players.get(1).getId()))
                .isInstanceOf(CommonException.class)
                .satisfies(e -> assertThat(errorCodeOf(e)).isEqualTo(ErrorCode.WRONG_PHASE));

        gameService.advancePhase(game.getId(), null);
        assertThatThrownBy(() -> gameService.castVote(game.getId(), players.get(0).getId(), players.get(0).getId()))
                .isInstanceOf(CommonException.class)
                .satisfies(e -> assertThat(errorCodeOf(e)).isEqualTo(ErrorCode.INVALID_TARGET));
    }

    @Test
    @DisplayName("마피아가 처형되면 시민이 승리하고 게임이 종료된다")
    void votingOutLastMafiaEndsGame() {
        // given
        Game game = startedGame(4, null);
        gameService.advancePhase(game.getId(), null);
        GamePlayer mafia = withRole(game, PlayerRole.MAFIA);
        GamePlayer someone = first(game, player -> !player.isMafia());
        for (GamePlayer player : playersOf(game)) {
            String target = player.isMafia() ? someone.getId() : mafia.getId();
            gameService.castVote(game.getId(), player.getId(), target);
        }

        // when
        Game ended = gameService.advancePhase(game.getId(), null);

        // then
        assertThat(ended.getCurrentPhase()).isEqualTo(GamePhase.ENDED);
        assertThat(ended.isActive()).isFalse();
        assertThat(ended.getWinner()).isEqualTo(Team.VILLAGERS);
        assertThat(ended.getTimeRemaining()).isZero();
        assertThat(ended.getGameLog()).contains(
                mafia.getName() + " was eliminated by vote",
                "Game ended - VILLAGERS wins!");
        // 내레이터가 없으면 종료 요약을 만들지 않음
        assertThat(ended.getNarrative()).isEqualTo(NarrativeService.OPENING_NARRATIVE);
        assertThat(playersOf(game)).allSatisfy(player -> {
            assertThat(player.getVotes()).isZero();
            assertThat(player.getVotedFor()).isNull();
        });
    }

    @Test
    @DisplayName("종료된 게임은 페이즈를 넘길 수 없고 상태도 바뀌지 않는다")
    void advanceOnEndedGameIsRejected() {
        // given
        Game game = startedGame(4, null);
        Game ended = gameService.endGame(game.getId(), null);
        List<GamePlayer> playersBefore = playersOf(game);

        // when & then
        assertThatThrownBy(() -> gameService.advancePhase(game.getId(), null))
                .isInstanceOf(CommonException.class)
                .satisfies(e -> assertThat(errorCodeOf(e)).isEqualTo(ErrorCode.GAME_ALREADY_ENDED));

        Game after = gameService.getGame(game.getId());
        assertThat(after.getCurrentPhase()).isEqualTo(GamePhase.ENDED);
        assertThat(after.getGameLog()).containsExactlyElementsOf(ended.getGameLog());
        assertThat(after.getDayNumber()).isEqualTo(ended.getDayNumber());
        assertThat(after.getUpdatedAt()).isEqualTo(ended.getUpdatedAt());
        assertThat(playersOf(game))
                .usingRecursiveFieldByFieldElementComparator()
                .containsExactlyElementsOf(playersBefore);
        assertThat(ended.getGameLog()).last().isEqualTo("Game ended by host");
    }

    // ==================== 밤 ====================

    @Test
    @DisplayName("의사가 마피아의 대상을 보호하면 아무도 죽지 않고 다음 날로 넘어간다")
    void doctorSavesTarget() {
        // given
        Game game = startedGame(4, null);
        gameService.advancePhase(game.getId(), null); // VOTING
        Game night = gameService.advancePhase(game.getId(), null); // 투표 없음 → NIGHT
        assertThat(night.getCurrentPhase()).isEqualTo(GamePhase.NIGHT);
        assertThat(night.getGameLog()).contains("No one was eliminated (tie vote)");

        GamePlayer mafia = withRole(game, PlayerRole.MAFIA);
        GamePlayer doctor = withRole(game, PlayerRole.DOCTOR);
        GamePlayer detective = withRole(game, PlayerRole.DETECTIVE);
        GamePlayer villager = withRole(game, PlayerRole.VILLAGER);

        gameService.takeAction(game.getId(), mafia.getId(), NightActionType.KILL, villager.getId());
        gameService.takeAction(game.getId(), doctor.getId(), NightActionType.HEAL, villager.getId());
        gameService.takeAction(game.getId(), detective.getId(), NightActionType.INVESTIGATE, mafia.getId());

        // when
        Game day = gameService.advancePhase(game.getId(), null);

        // then
        assertThat(day.getCurrentPhase()).isEqualTo(GamePhase.DAY);
        assertThat(day.getDayNumber()).isEqualTo(2);
        assertThat(day.getGameLog()).contains(
                "The doctor protected someone from harm.",
                "Someone was attacked but miraculously survived.",
                "The detective gathered crucial information.");
        assertThat(playersOf(game)).allSatisfy(player -> {
            assertThat(player.getStatus()).isEqualTo(PlayerStatus.ALIVE);
            assertThat(player.getLastAction()).isNull();
            assertThat(player.getActionTarget()).isNull();
        });
    }

    @Test
    @DisplayName("밤에 보호받지 못한 플레이어가 죽어 마피아가 과반이 되면 게임이 끝난다")
    void nightKillEndsGame() {
        // given
        Game game = startedGame(4, null);
        gameService.advancePhase(game.getId(), null); // VOTING
        GamePlayer mafia = withRole(game, PlayerRole.MAFIA);
        GamePlayer villager = withRole(game, PlayerRole.VILLAGER);
        GamePlayer detective = withRole(game, PlayerRole.DETECTIVE);
        for (GamePlayer player : playersOf(game)) {
            String target = player.getId().equals(villager.getId()) ? mafia.getId() : villager.getId();
            gameService.castVote(game.getId(), player.getId(), target);
        }
        Game night = gameService.advancePhase(game.getId(), null);
        assertThat(night.getCurrentPhase()).isEqualTo(GamePhase.NIGHT);

        gameService.takeAction(game.getId(), mafia.getId(), NightActionType.KILL, detective.getId());

        // when
        Game ended = gameService.advancePhase(game.getId(), null);

        // then
        assertThat(ended.getCurrentPhase()).isEqualTo(GamePhase.ENDED);
        assertThat(ended.getWinner()).isEqualTo(Team.MAFIA);
        assertThat(ended.isActive()).isFalse();
        assertThat(ended.getTimeRemaining()).isZero();
        assertThat(ended.getGameLog()).endsWith(
                detective.getName() + " was eliminated during the night",
                "Game ended - MAFIA wins!");
        assertThat(gameStore.findPlayer(detective.getId()).orElseThrow().getStatus())
                .isEqualTo(PlayerStatus.ELIMINATED);
    }

    @Test
    @DisplayName("밤 행동은 역할에 맞아야 하고 마피아는 마피아를 노릴 수 없다")
    void nightActionGuards() {
        // given
        Map<PlayerRole, Integer> distribution = new EnumMap<>(PlayerRole.class);
        distribution.put(PlayerRole.VILLAGER, 2);
        distribution.put(PlayerRole.DOCTOR, 1);
        distribution.put(PlayerRole.DETECTIVE, 1);
        distribution.put(PlayerRole.MAFIA, 2);
        Game game = startedGame(6, distribution);
        gameService.advancePhase(game.getId(), null);
        gameService.advancePhase(game.getId(), null);

        List<GamePlayer> mafia = playersOf(game).stream().filter(GamePlayer::isMafia).toList();
        GamePlayer villager = withRole(game, PlayerRole.VILLAGER);
        GamePlayer doctor = withRole(game, PlayerRole.DOCTOR);

        // then
        assertThat(mafia).hasSize(2);
        assertThatThrownBy(() -> gameService.takeAction(game.getId(), mafia.get(0).getId(),
                NightActionType.KILL, mafia.get(1).getId()))
                .isInstanceOf(CommonException.class)
                .satisfies(e -> assertThat(errorCodeOf(e)).isEqualTo(ErrorCode.INVALID_TARGET));
        assertThatThrownBy(() -> gameService.takeAction(game.getId(), villager.getId(),
                NightActionType.KILL, doctor.getId()))
                .isInstanceOf(CommonException.class)
                .satisfies(e -> assertThat(errorCodeOf(e)).isEqualTo(ErrorCode.INVALID_ACTION_FOR_ROLE));
        assertThatThrownBy(() -> gameService.takeAction(game.getId(), doctor.getId(),
                NightActionType.HEAL, doctor.getId()))
                .isInstanceOf(CommonException.class)
                .satisfies(e -> assertThat(errorCodeOf(e)).isEqualTo(ErrorCode.INVALID_TARGET));
    }

    // ==================== 조회 / 기타 ====================

    @Test
    @DisplayName("진행 중에는 살아있는 플레이어의 역할이 공개 상태에서 가려진다")
    void publicStateHidesRoles() {
        Game game = startedGame(4, null);

        GameState state = gameService.getGameState(game.getId());

        assertThat(state.players()).hasSize(4).allSatisfy(player -> assertThat(player.getRole()).isNull());
        assertThat(playersOf(game)).allSatisfy(player -> assertThat(player.getRole()).isNotNull());
    }

    @Test
    @DisplayName("방 코드는 6자리 대문자/숫자이고 대소문자 구분 없이 조회된다")
    void roomCodeLookup() {
        Game game = gameService.createGame("Lookup", 6, null);

        assertThat(game.getRoomCode()).matches("[A-Z0-9]{6}");
        assertThat(gameService.getGameByRoomCode(game.getRoomCode().toLowerCase()).getId()).isEqualTo(game.getId());
    }

    @Test
    @DisplayName("대기실에서 호스트의 연결이 끊기면 제거되고 다음 참가자가 호스트가 된다")
    void lobbyDisconnectHandsOverHost() {
        // given
        Game game = lobbyWithPlayers(3, null);
        List<GamePlayer> players = playersOf(game);
        GamePlayer host = players.get(0);

        // when
        gameService.handleDisconnect(host.getId());

        // then
        List<GamePlayer> remaining = playersOf(game);
        assertThat(remaining).hasSize(2).extracting(GamePlayer::getId).doesNotContain(host.getId());
        assertThat(remaining.get(0).isHost()).isTrue();
        assertThat(gameService.getGame(game.getId()).getHostId()).isEqualTo(remaining.get(0).getId());
    }

    @Test
    @DisplayName("게임 중 연결이 끊긴 플레이어는 제거되지 않는다")
    void disconnectDuringGameKeepsPlayer() {
        Game game = startedGame(4, null);
        GamePlayer player = playersOf(game).get(1);

        gameService.handleDisconnect(player.getId());

        assertThat(playersOf(game)).hasSize(4);
    }

    @Test
    @DisplayName("호스트를 넘기면 호스트는 항상 한 명이다")
    void transferHost() {
        Game game = lobbyWithPlayers(4, null);
        GamePlayer host = first(game, GamePlayer::isHost);
        GamePlayer next = first(game, player -> !player.isHost());

        Game updated = gameService.transferHost(game.getId(), host.getId(), next.getId());

        assertThat(updated.getHostId()).isEqualTo(next.getId());
        assertThat(playersOf(game)).filteredOn(GamePlayer::isHost)
                .extracting(GamePlayer::getId)
                .containsExactly(next.getId());
    }

    @Test
    @DisplayName("정원을 현재 인원보다 작게 바꿀 수 없다")
    void updateGameRejectsCapacityBelowPlayers() {
        Game game = lobbyWithPlayers(5, null);

        assertThatThrownBy(() -> gameService.updateGame(game.getId(), null, null, 4, null))
                .isInstanceOf(CommonException.class)
                .satisfies(e -> assertThat(errorCodeOf(e)).isEqualTo(ErrorCode.INVALID_SETTINGS));

        Game updated = gameService.updateGame(game.getId(), null, "Renamed", 10, null);
        assertThat(updated.getName()).isEqualTo("Renamed");
        assertThat(updated.getMaxPlayers()).isEqualTo(10);
    }

    @Test
    @DisplayName("내레이터가 설정되지 않았으면 내레이션 요청은 거부된다")
    void narrativeRequiresNarrator() {
        Game game = startedGame(4, null);

        assertThatThrownBy(() -> gameService.requestNarrative(game.getId(), null, "A storm approaches"))
                .isInstanceOf(CommonException.class)
                .satisfies(e -> assertThat(errorCodeOf(e)).isEqualTo(ErrorCode.NARRATOR_NOT_CONFIGURED));
    }

    @Test
    @DisplayName("게임을 삭제하면 더 이상 조회되지 않는다")
    void deleteGame() {
        Game game = lobbyWithPlayers(2, null);

        gameService.deleteGame(game.getId(), null);

        assertThat(gameStore.findGame(game.getId())).isEmpty();
        assertThat(playersOf(game)).isEmpty();
    }

    @Test
    @DisplayName("타이머는 진행 중인 게임의 남은 시간만 줄이고 페이즈는 바꾸지 않는다")
    void tickTimerIsAdvisory() {
        // given
        Game lobby = lobbyWithPlayers(2, null);
        Game started = startedGame(4, null);

        // when
        gameService.tickTimer(lobby.getId());
        gameService.tickTimer(started.getId());

        // then
        assertThat(gameService.getGame(lobby.getId()).getTimeRemaining())
                .isEqualTo(lobby.getTimeRemaining());
        Game ticked = gameService.getGame(started.getId());
        assertThat(ticked.getTimeRemaining()).isEqualTo(GameService.PHASE_DURATION_SECONDS - 1);
        assertThat(ticked.getCurrentPhase()).isEqualTo(GamePhase.DAY);
    }

    @Test
    @DisplayName("다른 게임의 플레이어는 해당 게임 참가자로 인정되지 않는다")
    void playerMembershipIsPerGame() {
        Game home = gameService.createGame("home", null, null);
        Game other = gameService.createGame("other", null, null);
        GamePlayer player = gameService.joinGame(home.getId(), "resident");

        assertThat(gameService.getPlayerInGame(home.getId(), player.getId()).getId()).isEqualTo(player.getId());
        assertThatThrownBy(() -> gameService.getPlayerInGame(other.getId(), player.getId()))
                .isInstanceOf(CommonException.class)
                .satisfies(e -> assertThat(errorCodeOf(e)).isEqualTo(ErrorCode.PLAYER_NOT_IN_GAME));
        assertThatThrownBy(() -> gameService.getPlayerInGame(home.getId(), "missing"))
                .isInstanceOf(CommonException.class)
                .satisfies(e -> assertThat(errorCodeOf(e)).isEqualTo(ErrorCode.PLAYER_NOT_FOUND));
    }
}
