package com.example.shadowbrook.game.domain;

public enum Team {
    MAFIA,
    VILLAGERS
}
