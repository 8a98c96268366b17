package com.example.shadowbrook.global.socket;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

/**
 * 클라이언트에서 들어오는 WebSocket 메시지. type 필드로 구분합니다.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = InboundMessage.RequestState.class, name = "GAME_UPDATE"),
        @JsonSubTypes.Type(value = InboundMessage.PlayerJoined.class, name = "PLAYER_JOINED"),
        @JsonSubTypes.Type(value = InboundMessage.ChatMessageSent.class, name = "CHAT_MESSAGE")
})
public interface InboundMessage {

    String gameId();

    record RequestState(@NotBlank String gameId) implements InboundMessage {
    }

    record PlayerJoined(@NotBlank String gameId, @NotBlank String playerId) implements InboundMessage {
    }

    record ChatMessageSent(
            @NotBlank String gameId,
            String playerId,
            @NotNull @Valid ChatPayload payload) implements InboundMessage {
    }

    record ChatPayload(@NotBlank @Size(max = 500) String message, boolean systemMessage) {
    }
}
