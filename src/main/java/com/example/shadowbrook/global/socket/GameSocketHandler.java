package com.example.shadowbrook.global.socket;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import com.example.shadowbrook.chat.service.ChatService;
import com.example.shadowbrook.game.service.GameService;
import com.example.shadowbrook.global.error.CommonException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

/**
 * /ws 엔드포인트. 들어온 메시지를 검증한 뒤 서비스로 전달하고, 실패는 보낸 연결에만 ERROR 로 응답합니다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class GameSocketHandler extends TextWebSocketHandler {

    private final ObjectMapper objectMapper;
    private final Validator validator;
    private final SessionRegistry sessionRegistry;
    private final GameService gameService;
    private final ChatService chatService;

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        log.debug("WebSocket 연결: connectionId={}", session.getId());
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        try {
            InboundMessage inbound = parse(message.getPayload());
            dispatch(session, inbound);
        } catch (CommonException e) {
            log.debug("WebSocket 요청 거부: connectionId={}, code={}", session.getId(), e.getErrorCode().getCode());
            sessionRegistry.sendTo(session, GameEvent.error(e.getMessage()));
        } catch (InvalidMessageException e) {
            log.debug("잘못된 WebSocket 메시지: connectionId={}, error={}", session.getId(), e.getMessage());
            sessionRegistry.sendTo(session, GameEvent.error(e.getMessage()));
        } catch (RuntimeException e) {
            log.error("WebSocket 메시지 처리 실패: connectionId={}", session.getId(), e);
            sessionRegistry.sendTo(session, GameEvent.error("Failed to process message"));
        }
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        List<String> releasedPlayers = sessionRegistry.unregister(session);
        for (String playerId : releasedPlayers) {
            try {
                gameService.handleDisconnect(playerId);
            } catch (RuntimeException e) {
                log.warn("연결 종료 처리 실패: playerId={}, error={}", playerId, e.getMessage());
            }
        }
    }

    private void dispatch(WebSocketSession session, InboundMessage inbound) {
        if (inbound instanceof InboundMessage.RequestState request) {
            sessionRegistry.sendTo(session, GameEvent.gameUpdate(gameService.getGameState(request.gameId())));
        } else if (inbound instanceof InboundMessage.PlayerJoined joined) {
            gameService.getPlayerInGame(joined.gameId(), joined.playerId());
            sessionRegistry.register(session, joined.gameId(), joined.playerId());
            sessionRegistry.broadcast(GameEvent.playerJoined(joined.gameId(),
                    Map.of("playerId", joined.playerId())));
        } else if (inbound instanceof InboundMessage.ChatMessageSent chat) {
            chatService.postMessage(chat.gameId(), chat.playerId(),
                    chat.payload().message(), chat.payload().systemMessage());
        }
    }

    private InboundMessage parse(String payload) {
        InboundMessage inbound;
        try {
            inbound = objectMapper.readValue(payload, InboundMessage.class);
        } catch (JsonProcessingException e) {
            throw new InvalidMessageException("Malformed message");
        }
        if (inbound == null) {
            throw new InvalidMessageException("Empty message");
        }

        Set<ConstraintViolation<InboundMessage>> violations = validator.validate(inbound);
        if (!violations.isEmpty()) {
            String detail = violations.stream()
                    .map(violation -> violation.getPropertyPath() + " " + violation.getMessage())
                    .collect(Collectors.joining(", "));
            throw new InvalidMessageException("Invalid message: " + detail);
        }
        return inbound;
    }

    static class InvalidMessageException extends RuntimeException {
        InvalidMessageException(String message) {
            super(message);
        }
    }
}
