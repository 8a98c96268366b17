package com.example.shadowbrook.game.domain;

public enum NightActionType {
    HEAL, // 의사 보호
    INVESTIGATE, // 탐정 조사
    KILL // 마피아 공격
}
