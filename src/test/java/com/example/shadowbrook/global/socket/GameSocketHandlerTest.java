package com.example.shadowbrook.global.socket;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.List;
import java.util.Map;

import com.example.shadowbrook.chat.service.ChatService;
import com.example.shadowbrook.game.service.GameService;
import com.example.shadowbrook.global.error.ErrorCode;
import com.fasterxml.jackson.databind.ObjectMapper;

import jakarta.validation.Validation;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

class GameSocketHandlerTest {

    private SessionRegistry sessionRegistry;
    private GameService gameService;
    private ChatService chatService;
    private GameSocketHandler handler;
    private WebSocketSession session;

    @BeforeEach
    void setUp() {
        sessionRegistry = mock(SessionRegistry.class);
        gameService = mock(GameService.class);
        chatService = mock(ChatService.class);
        handler = new GameSocketHandler(new ObjectMapper(),
                Validation.buildDefaultValidatorFactory().getValidator(),
                sessionRegistry, gameService, chatService);
        session = mock(WebSocketSession.class);
        when(session.getId()).thenReturn("c1");
    }

    private GameEvent sentEvent() {
        ArgumentCaptor<GameEvent> captor = ArgumentCaptor.forClass(GameEvent.class);
        verify(sessionRegistry).sendTo(eq(session), captor.capture());
        return captor.getValue();
    }

    @SuppressWarnings("unchecked")
    private String errorMessage(GameEvent event) {
        assertThat(event.type()).isEqualTo(EventType.ERROR);
        return ((Map<String, String>) event.payload()).get("message");
    }

    @Test
    @DisplayName("JSON 이 아닌 메시지는 보낸 연결에 ERROR 로 응답한다")
    void rejectsMalformedMessage() {
        handler.handleTextMessage(session, new TextMessage("{not json"));

        assertThat(errorMessage(sentEvent())).isEqualTo("Malformed message");
    }

    @Test
    @DisplayName("알 수 없는 type 은 잘못된 메시지로 처리한다")
    void rejectsUnknownType() {
        handler.handleTextMessage(session, new TextMessage("{\"type\":\"DANCE\",\"gameId\":\"g1\"}"));

        assertThat(errorMessage(sentEvent())).isEqualTo("Malformed message");
    }

    @Test
    @DisplayName("필수 필드가 빠진 메시지는 검증 오류로 응답한다")
    void rejectsInvalidMessage() {
        handler.handleTextMessage(session, new TextMessage("{\"type\":\"PLAYER_JOINED\",\"gameId\":\"g1\"}"));

        assertThat(errorMessage(sentEvent())).startsWith("Invalid message:").contains("playerId");
        verify(sessionRegistry, never()).register(any(), any(), any());
    }

    @Test
    @DisplayName("참가 메시지는 연결을 등록하고 PLAYER_JOINED 를 방송한다")
    void registersJoinedPlayer() {
        handler.handleTextMessage(session,
                new TextMessage("{\"type\":\"PLAYER_JOINED\",\"gameId\":\"g1\",\"playerId\":\"p1\"}"));

        verify(gameService).getPlayerInGame("g1", "p1");
        verify(sessionRegistry).register(session, "g1", "p1");
        ArgumentCaptor<GameEvent> captor = ArgumentCaptor.forClass(GameEvent.class);
        verify(sessionRegistry).broadcast(captor.capture());
        assertThat(captor.getValue().type()).isEqualTo(EventType.PLAYER_JOINED);
        assertThat(captor.getValue().gameId()).isEqualTo("g1");
    }

    @Test
    @DisplayName("존재하지 않는 게임 참가 요청은 오류 메시지로 응답한다")
    void reportsServiceErrors() {
        when(gameService.getPlayerInGame("missing", "p1")).thenThrow(ErrorCode.GAME_NOT_FOUND.commonException());

        handler.handleTextMessage(session,
                new TextMessage("{\"type\":\"PLAYER_JOINED\",\"gameId\":\"missing\",\"playerId\":\"p1\"}"));

        assertThat(errorMessage(sentEvent())).isEqualTo(ErrorCode.GAME_NOT_FOUND.getMessage());
        verify(sessionRegistry, never()).register(any(), any(), any());
    }

    @Test
    @DisplayName("다른 게임의 플레이어로 참가하면 등록하지 않고 오류로 응답한다")
    void rejectsPlayerOfAnotherGame() {
        when(gameService.getPlayerInGame("g1", "p9")).thenThrow(ErrorCode.PLAYER_NOT_IN_GAME.commonException());

        handler.handleTextMessage(session,
                new TextMessage("{\"type\":\"PLAYER_JOINED\",\"gameId\":\"g1\",\"playerId\":\"p9\"}"));

        assertThat(errorMessage(sentEvent())).isEqualTo(ErrorCode.PLAYER_NOT_IN_GAME.getMessage());
        verify(sessionRegistry, never()).register(any(), any(), any());
        verify(sessionRegistry, never()).broadcast(any(GameEvent.class));
    }

    @Test
    @DisplayName("채팅 메시지는 채팅 서비스로 전달된다")
    void forwardsChat() {
        handler.handleTextMessage(session, new TextMessage("""
                {"type":"CHAT_MESSAGE","gameId":"g1","playerId":"p1","payload":{"message":"hi"}}
                """));

        verify(chatService).postMessage("g1", "p1", "hi", false);
    }

    @Test
    @DisplayName("연결 종료 시 매핑된 플레이어마다 연결 해제를 처리한다")
    void handlesDisconnect() {
        when(sessionRegistry.unregister(session)).thenReturn(List.of("p1", "p2"));

        handler.afterConnectionClosed(session, CloseStatus.NORMAL);

        verify(gameService).handleDisconnect("p1");
        verify(gameService).handleDisconnect("p2");
    }
}
