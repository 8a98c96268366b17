package com.example.shadowbrook.game.dto.request;

/**
 * 호스트 전용 요청. playerId 가 있으면 호스트인지 확인합니다.
 */
public record HostActionRequest(String playerId) {
}
