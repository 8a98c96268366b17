package com.example.shadowbrook.chat.service;

import com.example.shadowbrook.chat.domain.ChatMessage;
import com.example.shadowbrook.game.domain.GamePlayer;
import com.example.shadowbrook.game.repository.GameStore;
import com.example.shadowbrook.global.concurrency.LockStrategy;
import com.example.shadowbrook.global.error.ErrorCode;
import com.example.shadowbrook.global.socket.GameEvent;
import com.example.shadowbrook.global.socket.SessionRegistry;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
@Slf4j
public class ChatService {

    private static final int MAX_MESSAGE_LENGTH = 500;

    private final GameStore gameStore;
    private final LockStrategy lockStrategy;
    private final SessionRegistry sessionRegistry;

    /**
     * 채팅 메시지 저장 후 게임 참가자 전체에게 전송합니다.
     * 시스템 메시지가 아니면 작성자는 해당 게임의 참가자여야 합니다.
     */
    public ChatMessage postMessage(String gameId, String playerId, String message, boolean systemMessage) {
        if (message == null || message.isBlank() || message.length() > MAX_MESSAGE_LENGTH) {
            throw ErrorCode.INVALID_REQUEST.commonException(
                    "Message must be between 1 and " + MAX_MESSAGE_LENGTH + " characters");
        }

        ChatMessage saved = lockStrategy.executeWithLock(gameId, () -> {
            gameStore.findGame(gameId).orElseThrow(ErrorCode.GAME_NOT_FOUND::commonException);
            if (!systemMessage) {
                GamePlayer author = gameStore.findPlayer(playerId)
                        .orElseThrow(ErrorCode.PLAYER_NOT_FOUND::commonException);
                if (!gameId.equals(author.getGameId())) {
                    throw ErrorCode.PLAYER_NOT_IN_GAME.commonException();
                }
            }

            return gameStore.createChatMessage(ChatMessage.builder()
                    .gameId(gameId)
                    .playerId(playerId)
                    .message(message)
                    .systemMessage(systemMessage)
                    .build());
        });

        log.debug("채팅 메시지: gameId={}, playerId={}, system={}", gameId, playerId, systemMessage);
        sessionRegistry.broadcast(GameEvent.chatMessage(gameId, saved));
        return saved;
    }
}
