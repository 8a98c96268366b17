package com.example.shadowbrook.chat.domain;

import java.time.Instant;

import lombok.Builder;

/**
 * 채팅 메시지. 생성 이후에는 변경되지 않습니다.
 */
@Builder(toBuilder = true)
public record ChatMessage(
        String id,
        String gameId,
        String playerId,
        String message,
        boolean systemMessage,
        long sequence,
        Instant createdAt) {
}
