package com.example.shadowbrook.game.service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;
import java.util.function.Supplier;
import java.util.stream.Collectors;

import com.example.shadowbrook.game.domain.Game;
import com.example.shadowbrook.game.domain.GamePhase;
import com.example.shadowbrook.game.domain.GamePlayer;
import com.example.shadowbrook.game.domain.GameState;
import com.example.shadowbrook.game.domain.NightActionType;
import com.example.shadowbrook.game.domain.PlayerRole;
import com.example.shadowbrook.game.domain.PlayerStatus;
import com.example.shadowbrook.game.domain.Players;
import com.example.shadowbrook.game.domain.Team;
import com.example.shadowbrook.game.repository.GameStore;
import com.example.shadowbrook.game.service.NightActionResolver.InvestigationResult;
import com.example.shadowbrook.game.service.NightActionResolver.NightResolution;
import com.example.shadowbrook.game.service.RoleAssigner.RoleAssignment;
import com.example.shadowbrook.game.service.VoteTabulator.VoteResult;
import com.example.shadowbrook.global.concurrency.LockStrategy;
import com.example.shadowbrook.global.error.ErrorCode;
import com.example.shadowbrook.global.socket.GameEvent;
import com.example.shadowbrook.global.socket.SessionRegistry;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * 게임 세션 상태 머신.
 * 게임별 락 안에서 조회 → 검증 → 변경 → 스냅샷을 수행하고, 락을 놓은 뒤에 브로드캐스트합니다.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class GameService {

    public static final int PHASE_DURATION_SECONDS = 300;
    private static final int DEFAULT_MAX_PLAYERS = 8;
    private static final int RECENT_EVENTS = 3;
    private static final String ROOM_CODE_LOCK = "room-codes";

    private final GameStore gameStore;
    private final LockStrategy lockStrategy;
    private final SessionRegistry sessionRegistry;
    private final GameValidator gameValidator;
    private final RoleAssigner roleAssigner;
    private final VoteTabulator voteTabulator;
    private final NightActionResolver nightActionResolver;
    private final WinConditionEvaluator winConditionEvaluator;
    private final NarrativeService narrativeService;
    private final RoomCodeGenerator roomCodeGenerator;

    private final Random random = new Random();
    // 스냅샷 순번. 게임 락 안에서 증가하므로 게임별로도 단조 증가
    private final AtomicLong revisions = new AtomicLong();

    // ==================== 세션 생성 / 조회 ====================

    public Game createGame(String name, Integer maxPlayers, Map<PlayerRole, Integer> roleDistribution) {
        int capacity = maxPlayers == null ? DEFAULT_MAX_PLAYERS : maxPlayers;
        gameValidator.validateSettings(name, capacity, 0, roleDistribution);

        // 방 코드 중복 확인과 저장을 하나의 구간에서 처리
        return lockStrategy.executeWithLock(ROOM_CODE_LOCK, () -> {
            Set<String> usedCodes = gameStore.findActiveGames().stream()
                    .map(Game::getRoomCode)
                    .collect(Collectors.toSet());
            String roomCode = roomCodeGenerator.generate(usedCodes::contains);

            Game game = gameStore.createGame(Game.builder()
                    .name(name.trim())
                    .roomCode(roomCode)
                    .maxPlayers(capacity)
                    .roleDistribution(Game.copyDistribution(roleDistribution))
                    .build());
            log.info("게임 생성: gameId={}, roomCode={}, maxPlayers={}", game.getId(), roomCode, capacity);
            return game;
        });
    }

    public Game getGame(String gameId) {
        return findGame(gameId);
    }

    public Game getGameByRoomCode(String roomCode) {
        String normalized = roomCode == null ? null : roomCode.trim().toUpperCase(Locale.ROOT);
        return gameStore.findGameByRoomCode(normalized)
                .orElseThrow(ErrorCode.GAME_NOT_FOUND::commonException);
    }

    /**
     * 해당 게임에 속한 플레이어를 반환합니다. 다른 게임의 플레이어면 PLAYER_NOT_IN_GAME.
     */
    public GamePlayer getPlayerInGame(String gameId, String playerId) {
        findGame(gameId);
        GamePlayer player = findPlayer(playerId);
        if (!gameId.equals(player.getGameId())) {
            throw ErrorCode.PLAYER_NOT_IN_GAME.commonException();
        }
        return player;
    }

    public GameState getGameState(String gameId) {
        return lockStrategy.executeWithLock(gameId, () -> {
            findGame(gameId);
            return snapshot(gameId);
        });
    }

    public Set<String> getActiveGameIds() {
        return gameStore.findActiveGames().stream()
                .map(Game::getId)
                .collect(Collectors.toSet());
    }

    // ==================== 대기실 ====================

    public Game updateGame(String gameId, String requesterId, String name, Integer maxPlayers,
            Map<PlayerRole, Integer> roleDistribution) {
        Transition<Game> transition = lockStrategy.executeWithLock(gameId, () -> {
            Game game = findGame(gameId);
            gameValidator.validateHost(game, requesterId);
            gameValidator.validatePhase(game, GamePhase.LOBBY);

            int playerCount = gameStore.findPlayersByGame(gameId).size();
            int capacity = maxPlayers == null ? game.getMaxPlayers() : maxPlayers;
            Map<PlayerRole, Integer> distribution = roleDistribution == null
                    ? game.getRoleDistribution()
                    : roleDistribution;
            gameValidator.validateSettings(name, capacity, playerCount, distribution);

            Game updated = saveGame(gameId, g -> {
                if (name != null) {
                    g.setName(name.trim());
                }
                g.setMaxPlayers(capacity);
                g.setRoleDistribution(Game.copyDistribution(distribution));
            });
            return Transition.of(updated, GameEvent.gameUpdate(snapshot(gameId)));
        });
        return publish(gameId, transition);
    }

    public GamePlayer joinGame(String gameId, String name) {
        Transition<GamePlayer> transition = lockStrategy.executeWithLock(gameId, () -> {
            Game game = findGame(gameId);
            List<GamePlayer> players = gameStore.findPlayersByGame(gameId);
            gameValidator.validateJoinable(game, players.size());

            // 호스트가 없으면 첫 참가자가 호스트
            boolean becomesHost = game.getHostId() == null || players.stream().noneMatch(GamePlayer::isHost);
            GamePlayer player = gameStore.createPlayer(GamePlayer.builder()
                    .gameId(gameId)
                    .name(name.trim())
                    .host(becomesHost)
                    .build());
            if (becomesHost) {
                saveGame(gameId, g -> g.setHostId(player.getId()));
            }

            log.info("플레이어 참가: gameId={}, playerId={}, host={}", gameId, player.getId(), becomesHost);
            return Transition.of(player,
                    GameEvent.playerJoined(gameId, player),
                    GameEvent.gameUpdate(snapshot(gameId)));
        });
        return publish(gameId, transition);
    }

    public GamePlayer updatePlayer(String playerId, String name, Boolean ready) {
        String gameId = findPlayer(playerId).getGameId();

        Transition<GamePlayer> transition = lockStrategy.executeWithLock(gameId, () -> {
            findPlayer(playerId);
            Game game = findGame(gameId);
            gameValidator.validateNotEnded(game);
            if (ready != null) {
                gameValidator.validatePhase(game, GamePhase.LOBBY);
            }
            if (name != null && name.isBlank()) {
                throw ErrorCode.INVALID_REQUEST.commonException("Player name must not be blank");
            }

            GamePlayer updated = savePlayer(playerId, p -> {
                if (name != null) {
                    p.setName(name.trim());
                }
                if (ready != null) {
                    p.setReady(ready);
                }
            });
            return Transition.of(updated, GameEvent.gameUpdate(snapshot(gameId)));
        });
        return publish(gameId, transition);
    }

    public Game transferHost(String gameId, String requesterId, String newHostId) {
        Transition<Game> transition = lockStrategy.executeWithLock(gameId, () -> {
            Game game = findGame(gameId);
            gameValidator.validateHost(game, requesterId);
            gameValidator.validateNotEnded(game);

            Players players = new Players(gameStore.findPlayersByGame(gameId));
            GamePlayer newHost = players.findById(newHostId)
                    .orElseThrow(ErrorCode.PLAYER_NOT_IN_GAME::commonException);

            players.findHost()
                    .filter(current -> !current.getId().equals(newHostId))
                    .ifPresent(current -> savePlayer(current.getId(), p -> p.setHost(false)));
            savePlayer(newHostId, p -> p.setHost(true));
            Game updated = saveGame(gameId, g -> g.setHostId(newHostId));

            log.info("호스트 변경: gameId={}, newHostId={}", gameId, newHost.getId());
            return Transition.of(updated, GameEvent.gameUpdate(snapshot(gameId)));
        });
        return publish(gameId, transition);
    }

    // ==================== 페이즈 전환 ====================

    public Game startGame(String gameId, String requesterId) {
        Transition<Game> transition = lockStrategy.executeWithLock(gameId, () -> {
            Game game = findGame(gameId);
            gameValidator.validateHost(game, requesterId);
            Players players = new Players(gameStore.findPlayersByGame(gameId));
            gameValidator.validateStartable(game, players);

            int playerCount = players.size();
            Map<PlayerRole, Integer> distribution =
                    roleAssigner.resolveDistribution(game.getRoleDistribution(), playerCount);
            Map<String, PlayerRole> rolesById = roleAssigner.assign(players.getAsList(), distribution, random)
                    .stream()
                    .collect(Collectors.toMap(RoleAssignment::playerId, RoleAssignment::role));

            List<GameEvent> events = new ArrayList<>();
            for (GamePlayer player : players.getAsList()) {
                // 분배 합계를 넘는 인원은 시민
                PlayerRole role = rolesById.getOrDefault(player.getId(), PlayerRole.VILLAGER);
                savePlayer(player.getId(), p -> {
                    p.setRole(role);
                    p.setStatus(PlayerStatus.ALIVE);
                    p.setVotes(0);
                    p.setVotedFor(null);
                    p.setLastAction(null);
                    p.setActionTarget(null);
                });
                events.add(GameEvent.roleReveal(gameId, player.getId(), role));
            }

            boolean narrate = narrativeService.isAvailable();
            Game updated = saveGame(gameId, g -> {
                g.setCurrentPhase(GamePhase.DAY);
                g.setDayNumber(1);
                g.setTimeRemaining(PHASE_DURATION_SECONDS);
                g.getGameLog().add("Game started with " + playerCount + " players");
                if (!narrate) {
                    g.setNarrative(NarrativeService.OPENING_NARRATIVE);
                    g.getGameLog().add(NarrativeService.OPENING_NARRATIVE);
                }
            });
            log.info("게임 시작: gameId={}, players={}, distribution={}", gameId, playerCount, distribution);

            events.add(0, GameEvent.phaseChange(snapshot(gameId)));
            Narration narration = narrate
                    ? new Narration(() -> narrativeService.generateNarrative(
                            new NarrativeContext(GamePhase.DAY, 1, playerCount, List.of(), null)), true)
                    : null;
            return new Transition<>(updated, events, narration);
        });
        return publish(gameId, transition);
    }

    public Game advancePhase(String gameId, String requesterId) {
        Transition<Game> transition = lockStrategy.executeWithLock(gameId, () -> {
            Game game = findGame(gameId);
            gameValidator.validateHost(game, requesterId);
            gameValidator.validateAdvance(game);

            Players players = new Players(gameStore.findPlayersByGame(gameId));
            List<String> logEntries = new ArrayList<>();
            List<GameEvent> privateEvents = new ArrayList<>();
            GamePhase nextPhase;
            int nextDay = game.getDayNumber();
            Team winner = null;

            switch (game.getCurrentPhase()) {
                case DAY -> {
                    logEntries.add("Day " + game.getDayNumber() + " voting phase begins");
                    nextPhase = GamePhase.VOTING;
                }
                case VOTING -> {
                    resolveVotes(players, logEntries);
                    winner = winConditionEvaluator.evaluate(players).orElse(null);
                    nextPhase = winner != null ? GamePhase.ENDED : GamePhase.NIGHT;
                }
                case NIGHT -> {
                    privateEvents.addAll(resolveNight(gameId, players, logEntries));
                    winner = winConditionEvaluator.evaluate(players).orElse(null);
                    nextPhase = winner != null ? GamePhase.ENDED : GamePhase.DAY;
                    if (winner == null) {
                        nextDay++;
                    }
                }
                default -> throw ErrorCode.INTERNAL_SERVER_ERROR.commonException(
                        "Unexpected phase " + game.getCurrentPhase());
            }

            if (winner != null) {
                logEntries.add("Game ended - " + winner + " wins!");
            }

            GamePhase targetPhase = nextPhase;
            Team decidedWinner = winner;
            int dayNumber = nextDay;
            Game updated = saveGame(gameId, g -> {
                g.setCurrentPhase(targetPhase);
                g.setDayNumber(dayNumber);
                g.getGameLog().addAll(logEntries);
                g.setTimeRemaining(targetPhase == GamePhase.ENDED ? 0 : PHASE_DURATION_SECONDS);
                if (decidedWinner != null) {
                    g.setActive(false);
                    g.setWinner(decidedWinner);
                }
            });
            log.info("페이즈 전환: gameId={}, {} -> {}, day={}", gameId, game.getCurrentPhase(), nextPhase, dayNumber);

            List<GameEvent> events = new ArrayList<>();
            events.add(GameEvent.phaseChange(snapshot(gameId)));
            events.addAll(privateEvents);
            return new Transition<>(updated, events, narrationFor(updated, players));
        });
        return publish(gameId, transition);
    }

    public Game endGame(String gameId, String requesterId) {
        Transition<Game> transition = lockStrategy.executeWithLock(gameId, () -> {
            Game game = findGame(gameId);
            gameValidator.validateHost(game, requesterId);
            gameValidator.validateNotEnded(game);

            Game updated = saveGame(gameId, g -> {
                g.setCurrentPhase(GamePhase.ENDED);
                g.setActive(false);
                g.setTimeRemaining(0);
                g.getGameLog().add("Game ended by host");
            });
            log.info("호스트가 게임 종료: gameId={}", gameId);
            return Transition.of(updated, GameEvent.phaseChange(snapshot(gameId)));
        });
        return publish(gameId, transition);
    }

    public void deleteGame(String gameId, String requesterId) {
        List<String> playerIds = lockStrategy.executeWithLock(gameId, () -> {
            Game game = findGame(gameId);
            gameValidator.validateHost(game, requesterId);

            List<String> ids = gameStore.findPlayersByGame(gameId).stream()
                    .map(GamePlayer::getId)
                    .toList();
            gameStore.deleteChatMessagesByGame(gameId);
            gameStore.deletePlayersByGame(gameId);
            gameStore.deleteGame(gameId);
            return ids;
        });

        sessionRegistry.closeGame(gameId, playerIds);
        lockStrategy.release(gameId);
        log.info("게임 삭제: gameId={}", gameId);
    }

    // ==================== 투표 / 밤 행동 ====================

    public GamePlayer castVote(String gameId, String voterId, String targetId) {
        Transition<GamePlayer> transition = lockStrategy.executeWithLock(gameId, () -> {
            Game game = findGame(gameId);
            Players players = new Players(gameStore.findPlayersByGame(gameId));
            GamePlayer voter = gameValidator.validateVote(game, players, voterId, targetId);

            // 재투표: 이전 대상의 표를 먼저 회수
            String previousTarget = voter.getVotedFor();
            if (previousTarget != null) {
                gameStore.updatePlayer(previousTarget, p -> p.setVotes(Math.max(0, p.getVotes() - 1)));
            }
            savePlayer(targetId, p -> p.setVotes(p.getVotes() + 1));
            GamePlayer updated = savePlayer(voterId, p -> p.setVotedFor(targetId));

            log.debug("투표: gameId={}, voter={}, target={}", gameId, voterId, targetId);
            return Transition.of(updated, GameEvent.voteCast(snapshot(gameId)));
        });
        return publish(gameId, transition);
    }

    public GamePlayer takeAction(String gameId, String actorId, NightActionType action, String targetId) {
        Transition<GamePlayer> transition = lockStrategy.executeWithLock(gameId, () -> {
            Game game = findGame(gameId);
            Players players = new Players(gameStore.findPlayersByGame(gameId));
            gameValidator.validateAction(game, players, actorId, action, targetId);

            GamePlayer updated = savePlayer(actorId, p -> {
                p.setLastAction(action);
                p.setActionTarget(targetId);
            });
            log.debug("밤 행동: gameId={}, actor={}, action={}", gameId, actorId, action);
            return Transition.of(updated, GameEvent.actionTaken(gameId, actorId));
        });
        return publish(gameId, transition);
    }

    // ==================== 내레이션 ====================

    public String requestNarrative(String gameId, String requesterId, String prompt) {
        NarrativeContext context = lockStrategy.executeWithLock(gameId, () -> {
            Game game = findGame(gameId);
            if (!narrativeService.isAvailable()) {
                throw ErrorCode.NARRATOR_NOT_CONFIGURED.commonException();
            }
            gameValidator.validateHost(game, requesterId);
            Players players = new Players(gameStore.findPlayersByGame(gameId));
            return new NarrativeContext(game.getCurrentPhase(), game.getDayNumber(),
                    players.findAllAlivePlayers().size(), recentEvents(game), prompt);
        });

        String narrative = narrativeService.generateNarrative(context);
        applyNarration(gameId, narrative, false);
        return narrative;
    }

    // ==================== 연결 / 타이머 ====================

    /**
     * 연결이 끊긴 플레이어 처리. 대기실에서만 제거하고 필요하면 호스트를 넘깁니다.
     */
    public void handleDisconnect(String playerId) {
        Optional<GamePlayer> found = gameStore.findPlayer(playerId);
        if (found.isEmpty()) {
            return;
        }
        String gameId = found.get().getGameId();

        Transition<Boolean> transition = lockStrategy.executeWithLock(gameId, () -> {
            Optional<Game> game = gameStore.findGame(gameId);
            Optional<GamePlayer> player = gameStore.findPlayer(playerId);
            if (game.isEmpty() || player.isEmpty() || game.get().getCurrentPhase() != GamePhase.LOBBY) {
                return new Transition<>(false, List.of(), null);
            }

            gameStore.deletePlayer(playerId);
            Players remaining = new Players(gameStore.findPlayersByGame(gameId));
            if (remaining.findHost().isEmpty()) {
                String newHostId = remaining.size() == 0 ? null : remaining.getAsList().get(0).getId();
                if (newHostId != null) {
                    savePlayer(newHostId, p -> p.setHost(true));
                }
                saveGame(gameId, g -> g.setHostId(newHostId));
                log.info("호스트 이탈, 호스트 변경: gameId={}, newHostId={}", gameId, newHostId);
            }

            log.info("대기실 플레이어 이탈: gameId={}, playerId={}", gameId, playerId);
            return Transition.of(true,
                    GameEvent.playerLeft(gameId, playerId),
                    GameEvent.gameUpdate(snapshot(gameId)));
        });
        publish(gameId, transition);
    }

    /**
     * 진행 중인 게임의 남은 시간을 1초 줄입니다. 페이즈는 바꾸지 않습니다.
     */
    public void tickTimer(String gameId) {
        Optional<GameEvent> event = lockStrategy.executeWithLock(gameId, () -> {
            Optional<Game> game = gameStore.findGame(gameId);
            if (game.isEmpty() || !game.get().isActive() || !game.get().getCurrentPhase().isInProgress()
                    || game.get().getTimeRemaining() <= 0) {
                return Optional.<GameEvent>empty();
            }
            Game updated = saveGame(gameId, g -> g.setTimeRemaining(g.getTimeRemaining() - 1));
            return Optional.of(GameEvent.timerUpdate(gameId, updated.getTimeRemaining(),
                    updated.getCurrentPhase(), updated.getDayNumber()));
        });
        event.ifPresent(sessionRegistry::broadcast);
    }

    // ==================== 결과 처리 ====================

    private void resolveVotes(Players players, List<String> logEntries) {
        VoteResult result = voteTabulator.tabulate(players);
        if (result.hasElimination()) {
            players.findById(result.eliminatedId()).ifPresent(target -> {
                savePlayer(target.getId(), p -> p.setStatus(PlayerStatus.ELIMINATED));
                target.setStatus(PlayerStatus.ELIMINATED);
                logEntries.add(target.getName() + " was eliminated by vote");
            });
        } else {
            logEntries.add("No one was eliminated (tie vote)");
        }

        for (GamePlayer player : players.getAsList()) {
            if (player.getVotes() != 0 || player.getVotedFor() != null) {
                savePlayer(player.getId(), p -> {
                    p.setVotes(0);
                    p.setVotedFor(null);
                });
            }
        }
        players.resetVotes();
    }

    private List<GameEvent> resolveNight(String gameId, Players players, List<String> logEntries) {
        NightResolution resolution = nightActionResolver.resolve(players);
        logEntries.addAll(resolution.events());

        for (String eliminatedId : resolution.eliminatedIds()) {
            players.findById(eliminatedId).ifPresent(target -> {
                savePlayer(target.getId(), p -> p.setStatus(PlayerStatus.ELIMINATED));
                target.setStatus(PlayerStatus.ELIMINATED);
                logEntries.add(target.getName() + " was eliminated during the night");
            });
        }

        for (GamePlayer player : players.getAsList()) {
            if (player.getLastAction() != null || player.getActionTarget() != null) {
                savePlayer(player.getId(), p -> {
                    p.setLastAction(null);
                    p.setActionTarget(null);
                });
            }
        }
        players.clearNightActions();

        List<GameEvent> events = new ArrayList<>();
        for (InvestigationResult investigation : resolution.investigations()) {
            events.add(GameEvent.investigationResult(gameId, investigation.detectiveId(),
                    investigation.targetId(), investigation.targetName(), investigation.targetRole()));
        }
        return events;
    }

    private Narration narrationFor(Game game, Players players) {
        if (!narrativeService.isAvailable()) {
            return null;
        }
        if (game.getCurrentPhase() == GamePhase.ENDED && game.getWinner() != null) {
            Team winner = game.getWinner();
            int playerCount = players.size();
            List<String> events = List.copyOf(game.getGameLog());
            return new Narration(() -> narrativeService.generateSummary(winner, playerCount, events).summary(), false);
        }
        if (game.getCurrentPhase() == GamePhase.ENDED) {
            return null;
        }
        NarrativeContext context = new NarrativeContext(game.getCurrentPhase(), game.getDayNumber(),
                players.findAllAlivePlayers().size(), recentEvents(game), null);
        return new Narration(() -> narrativeService.generateNarrative(context), false);
    }

    private List<String> recentEvents(Game game) {
        List<String> entries = game.getGameLog();
        return List.copyOf(entries.subList(Math.max(0, entries.size() - RECENT_EVENTS), entries.size()));
    }

    // ==================== 헬퍼 메소드 ====================

    /**
     * 락 밖에서 이벤트를 전송하고, 내레이션이 있으면 생성 후 별도 구간에서 반영합니다.
     */
    @SuppressWarnings("unchecked")
    private <T> T publish(String gameId, Transition<T> transition) {
        sessionRegistry.broadcast(transition.events());
        if (transition.narration() == null) {
            return transition.result();
        }
        String narrative = transition.narration().generator().get();
        Game narrated = applyNarration(gameId, narrative, transition.narration().appendToLog());
        if (narrated != null && transition.result() instanceof Game) {
            return (T) narrated;
        }
        return transition.result();
    }

    private Game applyNarration(String gameId, String narrative, boolean appendToLog) {
        Optional<Transition<Game>> transition = lockStrategy.executeWithLock(gameId, () ->
                gameStore.updateGame(gameId, g -> {
                    g.setNarrative(narrative);
                    if (appendToLog) {
                        g.getGameLog().add(narrative);
                    }
                }).map(updated -> Transition.of(updated, GameEvent.gameUpdate(snapshot(gameId)))));

        // 내레이션 생성 중 게임이 삭제되었으면 무시
        transition.ifPresent(t -> sessionRegistry.broadcast(t.events()));
        return transition.map(Transition::result).orElse(null);
    }

    private GameState snapshot(String gameId) {
        Game game = findGame(gameId);
        return GameState.publicView(revisions.incrementAndGet(), game, gameStore.findPlayersByGame(gameId),
                gameStore.findChatMessagesByGame(gameId));
    }

    private Game findGame(String gameId) {
        return gameStore.findGame(gameId)
                .orElseThrow(ErrorCode.GAME_NOT_FOUND::commonException);
    }

    private GamePlayer findPlayer(String playerId) {
        return gameStore.findPlayer(playerId)
                .orElseThrow(ErrorCode.PLAYER_NOT_FOUND::commonException);
    }

    private Game saveGame(String gameId, Consumer<Game> updater) {
        return gameStore.updateGame(gameId, updater)
                .orElseThrow(ErrorCode.GAME_NOT_FOUND::commonException);
    }

    private GamePlayer savePlayer(String playerId, Consumer<GamePlayer> updater) {
        return gameStore.updatePlayer(playerId, updater)
                .orElseThrow(ErrorCode.PLAYER_NOT_FOUND::commonException);
    }

    private record Transition<T>(T result, List<GameEvent> events, Narration narration) {

        static <T> Transition<T> of(T result, GameEvent... events) {
            return new Transition<>(result, List.of(events), null);
        }
    }

    private record Narration(Supplier<String> generator, boolean appendToLog) {
    }
}
