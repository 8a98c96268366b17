package com.example.shadowbrook.global.socket;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum EventType {
    GAME_UPDATE(false),
    PHASE_CHANGE(false),
    VOTE_CAST(false),
    PLAYER_JOINED(false),
    PLAYER_LEFT(false),
    CHAT_MESSAGE(false),
    ROLE_REVEAL(true), // 본인에게만
    ACTION_TAKEN(false),
    INVESTIGATION_RESULT(true), // 탐정에게만
    TIMER_UPDATE(false),
    ERROR(true);

    private final boolean privateDelivery;
}
