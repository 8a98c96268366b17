package com.example.shadowbrook.game.repository;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

import com.example.shadowbrook.chat.domain.ChatMessage;
import com.example.shadowbrook.game.domain.Game;
import com.example.shadowbrook.game.domain.GamePlayer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

/**
 * 단일 프로세스용 메모리 저장소 (기본값)
 */
@Slf4j
@Repository
@ConditionalOnProperty(name = "mafia.store", havingValue = "memory", matchIfMissing = true)
public class InMemoryGameStore implements GameStore {

    private final Map<String, Game> games = new ConcurrentHashMap<>();
    private final Map<String, GamePlayer> players = new ConcurrentHashMap<>();
    // gameId → 참가 순서대로 정렬된 playerId
    private final Map<String, List<String>> playerIdsByGame = new ConcurrentHashMap<>();
    private final Map<String, List<ChatMessage>> chatByGame = new ConcurrentHashMap<>();
    private final AtomicLong chatSequence = new AtomicLong();

    @Override
    public Game createGame(Game game) {
        Game stored = game.copy();
        Instant now = Instant.now();
        if (stored.getId() == null) {
            stored.setId(UUID.randomUUID().toString());
        }
        stored.setCreatedAt(now);
        stored.setUpdatedAt(now);
        games.put(stored.getId(), stored);
        log.debug("게임 저장: gameId={}, roomCode={}", stored.getId(), stored.getRoomCode());
        return stored.copy();
    }

    @Override
    public Optional<Game> findGame(String gameId) {
        if (gameId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(games.get(gameId)).map(Game::copy);
    }

    @Override
    public Optional<Game> findGameByRoomCode(String roomCode) {
        if (roomCode == null) {
            return Optional.empty();
        }
        return games.values().stream()
                .filter(game -> roomCode.equals(game.getRoomCode()))
                .sorted((a, b) -> Boolean.compare(b.isActive(), a.isActive()))
                .findFirst()
                .map(Game::copy);
    }

    @Override
    public List<Game> findActiveGames() {
        return games.values().stream()
                .filter(Game::isActive)
                .map(Game::copy)
                .toList();
    }

    @Override
    public Optional<Game> updateGame(String gameId, Consumer<Game> updater) {
        if (gameId == null) {
            return Optional.empty();
        }
        Game updated = games.computeIfPresent(gameId, (id, current) -> {
            Game copy = current.copy();
            updater.accept(copy);
            copy.setUpdatedAt(Instant.now());
            return copy;
        });
        return Optional.ofNullable(updated).map(Game::copy);
    }

    @Override
    public boolean deleteGame(String gameId) {
        return gameId != null && games.remove(gameId) != null;
    }

    @Override
    public GamePlayer createPlayer(GamePlayer player) {
        GamePlayer stored = player.copy();
        if (stored.getId() == null) {
            stored.setId(UUID.randomUUID().toString());
        }
        stored.setJoinedAt(Instant.now());
        players.put(stored.getId(), stored);
        playerIdsByGame.computeIfAbsent(stored.getGameId(), id -> new CopyOnWriteArrayList<>()).add(stored.getId());
        return stored.copy();
    }

    @Override
    public Optional<GamePlayer> findPlayer(String playerId) {
        if (playerId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(players.get(playerId)).map(GamePlayer::copy);
    }

    @Override
    public List<GamePlayer> findPlayersByGame(String gameId) {
        List<String> ids = playerIdsByGame.getOrDefault(gameId, List.of());
        return ids.stream()
                .map(players::get)
                .filter(Objects::nonNull)
                .map(GamePlayer::copy)
                .toList();
    }

    @Override
    public Optional<GamePlayer> updatePlayer(String playerId, Consumer<GamePlayer> updater) {
        if (playerId == null) {
            return Optional.empty();
        }
        GamePlayer updated = players.computeIfPresent(playerId, (id, current) -> {
            GamePlayer copy = current.copy();
            updater.accept(copy);
            return copy;
        });
        return Optional.ofNullable(updated).map(GamePlayer::copy);
    }

    @Override
    public boolean deletePlayer(String playerId) {
        if (playerId == null) {
            return false;
        }
        GamePlayer removed = players.remove(playerId);
        if (removed == null) {
            return false;
        }
        List<String> ids = playerIdsByGame.get(removed.getGameId());
        if (ids != null) {
            ids.remove(playerId);
        }
        return true;
    }

    @Override
    public void deletePlayersByGame(String gameId) {
        List<String> ids = playerIdsByGame.remove(gameId);
        if (ids != null) {
            ids.forEach(players::remove);
        }
    }

    @Override
    public ChatMessage createChatMessage(ChatMessage message) {
        ChatMessage stored = message.toBuilder()
                .id(UUID.randomUUID().toString())
                .sequence(chatSequence.incrementAndGet())
                .createdAt(Instant.now())
                .build();
        chatByGame.computeIfAbsent(stored.gameId(), id -> new CopyOnWriteArrayList<>()).add(stored);
        return stored;
    }

    @Override
    public List<ChatMessage> findChatMessagesByGame(String gameId) {
        return new ArrayList<>(chatByGame.getOrDefault(gameId, List.of()));
    }

    @Override
    public void deleteChatMessagesByGame(String gameId) {
        chatByGame.remove(gameId);
    }
}
