package com.example.shadowbrook.game.domain;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum PlayerRole {
    VILLAGER(null, "You have no special ability. Find the Mafia through discussion and votes."),
    DOCTOR(NightActionType.HEAL, "Each night, choose one player to protect from the Mafia."),
    DETECTIVE(NightActionType.INVESTIGATE, "Each night, choose one player and learn their true role."),
    MAFIA(NightActionType.KILL, "Each night, choose one player to eliminate.");

    private final NightActionType nightAction;
    private final String description;

    /**
     * 역할별로 허용된 밤 행동인지 확인합니다. 시민은 어떤 행동도 할 수 없습니다.
     */
    public boolean canPerform(NightActionType action) {
        return nightAction != null && nightAction == action;
    }

    public Team getTeam() {
        return this == MAFIA ? Team.MAFIA : Team.VILLAGERS;
    }
}
