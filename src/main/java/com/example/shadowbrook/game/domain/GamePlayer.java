package com.example.shadowbrook.game.domain;

import java.time.Instant;

import com.fasterxml.jackson.annotation.JsonIgnore;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Getter
@Setter
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class GamePlayer {

    private String id;
    private String gameId;
    private String name;

    private PlayerRole role;

    @Builder.Default
    private PlayerStatus status = PlayerStatus.ALIVE;

    private boolean ready;
    private boolean host;

    @Builder.Default
    private int votes = 0;

    private String votedFor;

    private NightActionType lastAction;
    private String actionTarget;

    private Instant joinedAt;

    @JsonIgnore
    public boolean isAlive() {
        return status == PlayerStatus.ALIVE;
    }

    @JsonIgnore
    public boolean isMafia() {
        return role == PlayerRole.MAFIA;
    }

    public GamePlayer copy() {
        return toBuilder().build();
    }

    /**
     * 다른 참가자에게 보여줄 사본. 역할과 밤 행동 정보를 가립니다.
     */
    public GamePlayer concealed() {
        return toBuilder()
                .role(null)
                .lastAction(null)
                .actionTarget(null)
                .build();
    }
}
