package com.example.shadowbrook.game.repository;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.function.Consumer;

import com.example.shadowbrook.chat.domain.ChatMessage;
import com.example.shadowbrook.game.domain.Game;
import com.example.shadowbrook.game.domain.GamePlayer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Repository;

/**
 * Redis 저장소. mafia.store=redis 일 때 사용됩니다.
 */
@Slf4j
@Repository
@RequiredArgsConstructor
@ConditionalOnProperty(name = "mafia.store", havingValue = "redis")
public class RedisGameStore implements GameStore {

    private final RedisTemplate<String, Game> gameRedisTemplate;
    private final RedisTemplate<String, GamePlayer> playerRedisTemplate;
    private final RedisTemplate<String, ChatMessage> chatRedisTemplate;
    private final StringRedisTemplate stringRedisTemplate;

    // Redis Key Prefix
    private static final String GAME_KEY_PREFIX = "game:";
    private static final String ROOM_KEY_PREFIX = "game:room:";
    private static final String PLAYER_KEY_PREFIX = "player:";
    private static final String ACTIVE_GAMES_KEY = "game:active";
    // TTL
    private static final Duration TTL = Duration.ofHours(6);

    // ==================== Game ====================

    @Override
    public Game createGame(Game game) {
        Game stored = game.copy();
        Instant now = Instant.now();
        if (stored.getId() == null) {
            stored.setId(UUID.randomUUID().toString());
        }
        stored.setCreatedAt(now);
        stored.setUpdatedAt(now);
        saveGame(stored);
        return stored;
    }

    @Override
    public Optional<Game> findGame(String gameId) {
        if (gameId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(gameRedisTemplate.opsForValue().get(gameKey(gameId)));
    }

    @Override
    public Optional<Game> findGameByRoomCode(String roomCode) {
        if (roomCode == null) {
            return Optional.empty();
        }
        String gameId = stringRedisTemplate.opsForValue().get(ROOM_KEY_PREFIX + roomCode);
        return findGame(gameId);
    }

    @Override
    public List<Game> findActiveGames() {
        Set<String> ids = stringRedisTemplate.opsForSet().members(ACTIVE_GAMES_KEY);
        if (ids == null || ids.isEmpty()) {
            return List.of();
        }
        List<Game> result = new ArrayList<>();
        for (String id : ids) {
            Optional<Game> game = findGame(id);
            if (game.isPresent() && game.get().isActive()) {
                result.add(game.get());
            } else {
                // 만료되었거나 종료된 게임은 인덱스에서 제거
                stringRedisTemplate.opsForSet().remove(ACTIVE_GAMES_KEY, id);
            }
        }
        return result;
    }

    @Override
    public Optional<Game> updateGame(String gameId, Consumer<Game> updater) {
        Optional<Game> current = findGame(gameId);
        current.ifPresent(game -> {
            updater.accept(game);
            game.setUpdatedAt(Instant.now());
            saveGame(game);
        });
        return current;
    }

    @Override
    public boolean deleteGame(String gameId) {
        Optional<Game> game = findGame(gameId);
        if (game.isEmpty()) {
            return false;
        }
        stringRedisTemplate.delete(ROOM_KEY_PREFIX + game.get().getRoomCode());
        stringRedisTemplate.opsForSet().remove(ACTIVE_GAMES_KEY, gameId);
        gameRedisTemplate.delete(gameKey(gameId));
        return true;
    }

    private void saveGame(Game game) {
        gameRedisTemplate.opsForValue().set(gameKey(game.getId()), game, TTL);
        stringRedisTemplate.opsForValue().set(ROOM_KEY_PREFIX + game.getRoomCode(), game.getId(), TTL);
        if (game.isActive()) {
            stringRedisTemplate.opsForSet().add(ACTIVE_GAMES_KEY, game.getId());
        } else {
            stringRedisTemplate.opsForSet().remove(ACTIVE_GAMES_KEY, game.getId());
        }
    }

    // ==================== Player ====================

    @Override
    public GamePlayer createPlayer(GamePlayer player) {
        GamePlayer stored = player.copy();
        if (stored.getId() == null) {
            stored.setId(UUID.randomUUID().toString());
        }
        stored.setJoinedAt(Instant.now());
        playerRedisTemplate.opsForValue().set(playerKey(stored.getId()), stored, TTL);
        String playersKey = playersKey(stored.getGameId());
        stringRedisTemplate.opsForList().rightPush(playersKey, stored.getId());
        stringRedisTemplate.expire(playersKey, TTL);
        return stored;
    }

    @Override
    public Optional<GamePlayer> findPlayer(String playerId) {
        if (playerId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(playerRedisTemplate.opsForValue().get(playerKey(playerId)));
    }

    @Override
    public List<GamePlayer> findPlayersByGame(String gameId) {
        List<String> ids = stringRedisTemplate.opsForList().range(playersKey(gameId), 0, -1);
        if (ids == null || ids.isEmpty()) {
            return List.of();
        }
        List<String> keys = ids.stream().map(this::playerKey).toList();
        List<GamePlayer> players = playerRedisTemplate.opsForValue().multiGet(keys);
        if (players == null) {
            return List.of();
        }
        return players.stream().filter(Objects::nonNull).toList();
    }

    @Override
    public Optional<GamePlayer> updatePlayer(String playerId, Consumer<GamePlayer> updater) {
        Optional<GamePlayer> current = findPlayer(playerId);
        current.ifPresent(player -> {
            updater.accept(player);
            playerRedisTemplate.opsForValue().set(playerKey(playerId), player, TTL);
        });
        return current;
    }

    @Override
    public boolean deletePlayer(String playerId) {
        Optional<GamePlayer> player = findPlayer(playerId);
        if (player.isEmpty()) {
            return false;
        }
        stringRedisTemplate.opsForList().remove(playersKey(player.get().getGameId()), 0, playerId);
        playerRedisTemplate.delete(playerKey(playerId));
        return true;
    }

    @Override
    public void deletePlayersByGame(String gameId) {
        List<String> ids = stringRedisTemplate.opsForList().range(playersKey(gameId), 0, -1);
        if (ids != null && !ids.isEmpty()) {
            playerRedisTemplate.delete(ids.stream().map(this::playerKey).toList());
        }
        stringRedisTemplate.delete(playersKey(gameId));
    }

    // ==================== Chat ====================

    @Override
    public ChatMessage createChatMessage(ChatMessage message) {
        Long sequence = stringRedisTemplate.opsForValue().increment(chatKey(message.gameId()) + ":seq");
        ChatMessage stored = message.toBuilder()
                .id(UUID.randomUUID().toString())
                .sequence(sequence == null ? 0 : sequence)
                .createdAt(Instant.now())
                .build();
        chatRedisTemplate.opsForList().rightPush(chatKey(stored.gameId()), stored);
        chatRedisTemplate.expire(chatKey(stored.gameId()), TTL);
        return stored;
    }

    @Override
    public List<ChatMessage> findChatMessagesByGame(String gameId) {
        List<ChatMessage> messages = chatRedisTemplate.opsForList().range(chatKey(gameId), 0, -1);
        return messages == null ? List.of() : messages;
    }

    @Override
    public void deleteChatMessagesByGame(String gameId) {
        chatRedisTemplate.delete(chatKey(gameId));
        stringRedisTemplate.delete(chatKey(gameId) + ":seq");
    }

    // ==================== Key ====================

    private String gameKey(String gameId) {
        return GAME_KEY_PREFIX + gameId;
    }

    private String playersKey(String gameId) {
        return GAME_KEY_PREFIX + gameId + ":players";
    }

    private String chatKey(String gameId) {
        return GAME_KEY_PREFIX + gameId + ":chat";
    }

    private String playerKey(String playerId) {
        return PLAYER_KEY_PREFIX + playerId;
    }
}
