package com.example.shadowbrook.game.domain;

public enum PlayerStatus {
    ALIVE,
    ELIMINATED,
    SPECTATOR
}
