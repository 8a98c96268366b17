package com.example.shadowbrook.global.socket;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import com.example.shadowbrook.game.domain.GameState;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;

/**
 * 게임별 WebSocket 연결 관리 및 메시지 전송.
 * 전송 실패는 호출한 게임 로직으로 전파하지 않습니다.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SessionRegistry {

    private static final int SEND_TIME_LIMIT_MS = 10_000;
    private static final int BUFFER_SIZE_LIMIT = 512 * 1024;

    private final ObjectMapper objectMapper;

    // connectionId → 동시 전송이 가능한 래핑 세션
    private final Map<String, WebSocketSession> connections = new ConcurrentHashMap<>();
    // gameId → connectionId 목록
    private final Map<String, Set<String>> gameConnections = new ConcurrentHashMap<>();
    // playerId → 현재 connectionId (나중 등록이 이전 등록을 대체)
    private final Map<String, String> playerConnections = new ConcurrentHashMap<>();
    // connectionId → 등록 내역 (연결 종료 시 정리용)
    private final Map<String, Registration> registrations = new ConcurrentHashMap<>();
    // gameId → 마지막으로 전송한 스냅샷 revision
    private final Map<String, RevisionGate> revisionGates = new ConcurrentHashMap<>();

    // ================== 등록 / 해제 ================== //

    /**
     * 연결을 게임과 (선택적으로) 플레이어에 등록합니다.
     */
    public synchronized void register(WebSocketSession session, String gameId, String playerId) {
        String connectionId = session.getId();
        connections.computeIfAbsent(connectionId, id -> decorate(session));
        Registration registration = registrations.computeIfAbsent(connectionId, id -> new Registration());

        gameConnections.computeIfAbsent(gameId, id -> ConcurrentHashMap.newKeySet()).add(connectionId);
        registration.gameIds().add(gameId);

        if (playerId != null) {
            String previous = playerConnections.put(playerId, connectionId);
            if (previous != null && !previous.equals(connectionId)) {
                Registration previousRegistration = registrations.get(previous);
                if (previousRegistration != null) {
                    previousRegistration.playerIds().remove(playerId);
                }
            }
            registration.playerIds().add(playerId);
        }
        log.debug("연결 등록: connectionId={}, gameId={}, playerId={}", connectionId, gameId, playerId);
    }

    /**
     * 연결의 모든 등록을 해제하고, 이 연결에 매핑되어 있던 플레이어 ID 를 반환합니다.
     */
    public synchronized List<String> unregister(WebSocketSession session) {
        String connectionId = session.getId();
        connections.remove(connectionId);
        Registration registration = registrations.remove(connectionId);
        if (registration == null) {
            return List.of();
        }

        for (String gameId : registration.gameIds()) {
            Set<String> members = gameConnections.get(gameId);
            if (members != null) {
                members.remove(connectionId);
                if (members.isEmpty()) {
                    gameConnections.remove(gameId);
                }
            }
        }

        List<String> releasedPlayers = new ArrayList<>();
        for (String playerId : registration.playerIds()) {
            if (playerConnections.remove(playerId, connectionId)) {
                releasedPlayers.add(playerId);
            }
        }
        log.debug("연결 해제: connectionId={}, players={}", connectionId, releasedPlayers);
        return releasedPlayers;
    }

    /**
     * 삭제된 게임의 등록 정보를 정리합니다. 연결 자체는 닫지 않습니다.
     */
    public synchronized void closeGame(String gameId, Collection<String> playerIds) {
        revisionGates.remove(gameId);
        Set<String> members = gameConnections.remove(gameId);
        if (members != null) {
            for (String connectionId : members) {
                Registration registration = registrations.get(connectionId);
                if (registration != null) {
                    registration.gameIds().remove(gameId);
                    registration.playerIds().removeAll(playerIds);
                }
            }
        }
        playerIds.forEach(playerConnections::remove);
    }

    public int connectionCount(String gameId) {
        return gameConnections.getOrDefault(gameId, Set.of()).size();
    }

    // ================== 전송 ================== //

    /**
     * 게임 참가자 전체에게 전송합니다. 개인 이벤트는 대상 플레이어의 연결로만 보냅니다.
     * 스냅샷 이벤트는 이미 더 최신 revision 을 보낸 게임이면 버립니다.
     */
    public void broadcast(GameEvent event) {
        TextMessage message = serialize(event);
        if (message == null) {
            return;
        }

        if (event.type().isPrivateDelivery()) {
            String connectionId = event.playerId() == null ? null : playerConnections.get(event.playerId());
            if (connectionId == null) {
                log.debug("개인 메시지 수신자가 연결되어 있지 않음: type={}, playerId={}", event.type(), event.playerId());
                return;
            }
            deliver(event.gameId(), connectionId, message);
            return;
        }

        if (event.payload() instanceof GameState state && event.gameId() != null) {
            RevisionGate gate = revisionGates.computeIfAbsent(event.gameId(), id -> new RevisionGate());
            // 확인과 전송은 같은 구간에서
            synchronized (gate) {
                if (state.revision() < gate.lastSent) {
                    log.debug("오래된 스냅샷 폐기: gameId={}, revision={}, lastSent={}",
                            event.gameId(), state.revision(), gate.lastSent);
                    return;
                }
                gate.lastSent = state.revision();
                fanOut(event.gameId(), message);
            }
            return;
        }
        fanOut(event.gameId(), message);
    }

    public void broadcast(List<GameEvent> events) {
        events.forEach(this::broadcast);
    }

    /**
     * 특정 연결에 직접 응답합니다. (상태 요청 응답, 에러)
     */
    public void sendTo(WebSocketSession session, GameEvent event) {
        TextMessage message = serialize(event);
        if (message == null) {
            return;
        }
        WebSocketSession target = connections.getOrDefault(session.getId(), session);
        send(target, message);
    }

    // ================== 헬퍼 메소드 ================== //

    private void fanOut(String gameId, TextMessage message) {
        Set<String> members = gameId == null ? null : gameConnections.get(gameId);
        if (members == null) {
            return;
        }
        for (String connectionId : List.copyOf(members)) {
            deliver(gameId, connectionId, message);
        }
    }

    private void deliver(String gameId, String connectionId, TextMessage message) {
        WebSocketSession session = connections.get(connectionId);
        if (session == null || !session.isOpen()) {
            // 닫힌 연결은 게임 목록에서 제외, 플레이어 정리는 연결 종료 콜백에서 처리
            Set<String> members = gameId == null ? null : gameConnections.get(gameId);
            if (members != null) {
                members.remove(connectionId);
            }
            return;
        }
        if (!send(session, message)) {
            closeQuietly(session);
        }
    }

    private boolean send(WebSocketSession session, TextMessage message) {
        try {
            if (session.isOpen()) {
                session.sendMessage(message);
                return true;
            }
        } catch (IOException | IllegalStateException e) {
            log.warn("메시지 전송 실패: connectionId={}, error={}", session.getId(), e.getMessage());
        }
        return false;
    }

    private void closeQuietly(WebSocketSession session) {
        try {
            session.close(CloseStatus.SESSION_NOT_RELIABLE);
        } catch (IOException e) {
            log.debug("연결 종료 실패: connectionId={}, error={}", session.getId(), e.getMessage());
        }
    }

    private TextMessage serialize(GameEvent event) {
        try {
            return new TextMessage(objectMapper.writeValueAsString(event));
        } catch (JsonProcessingException e) {
            log.error("이벤트 직렬화 실패: type={}, gameId={}", event.type(), event.gameId(), e);
            return null;
        }
    }

    private WebSocketSession decorate(WebSocketSession session) {
        if (session instanceof ConcurrentWebSocketSessionDecorator) {
            return session;
        }
        return new ConcurrentWebSocketSessionDecorator(session, SEND_TIME_LIMIT_MS, BUFFER_SIZE_LIMIT);
    }

    private static final class RevisionGate {
        private long lastSent;
    }

    private record Registration(Set<String> gameIds, Set<String> playerIds) {
        Registration() {
            this(ConcurrentHashMap.newKeySet(), ConcurrentHashMap.newKeySet());
        }
    }
}
