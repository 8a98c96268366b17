package com.example.shadowbrook.game.domain;

public enum GamePhase {
    LOBBY, // 대기실 (참가/준비)
    DAY, // 낮 토론
    VOTING, // 낮 투표
    NIGHT, // 밤 행동
    ENDED; // 게임 종료

    public boolean isInProgress() {
        return this == DAY || this == VOTING || this == NIGHT;
    }
}
