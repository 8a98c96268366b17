package com.example.shadowbrook.game.repository;

import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

import com.example.shadowbrook.chat.domain.ChatMessage;
import com.example.shadowbrook.game.domain.Game;
import com.example.shadowbrook.game.domain.GamePlayer;

/**
 * 게임/플레이어/채팅 저장소.
 * 조회 결과는 항상 사본이며, 변경은 update 의 Consumer 로만 반영됩니다.
 */
public interface GameStore {

    // ==================== Game ====================

    Game createGame(Game game);

    Optional<Game> findGame(String gameId);

    Optional<Game> findGameByRoomCode(String roomCode);

    List<Game> findActiveGames();

    /**
     * 저장된 게임의 사본에 변경을 적용하고 저장합니다. updatedAt 이 갱신됩니다.
     */
    Optional<Game> updateGame(String gameId, Consumer<Game> updater);

    boolean deleteGame(String gameId);

    // ==================== Player ====================

    GamePlayer createPlayer(GamePlayer player);

    Optional<GamePlayer> findPlayer(String playerId);

    /**
     * 참가 순서대로 반환합니다.
     */
    List<GamePlayer> findPlayersByGame(String gameId);

    Optional<GamePlayer> updatePlayer(String playerId, Consumer<GamePlayer> updater);

    boolean deletePlayer(String playerId);

    void deletePlayersByGame(String gameId);

    // ==================== Chat ====================

    /**
     * id, sequence, createdAt 을 부여해 저장합니다.
     */
    ChatMessage createChatMessage(ChatMessage message);

    List<ChatMessage> findChatMessagesByGame(String gameId);

    void deleteChatMessagesByGame(String gameId);
}
