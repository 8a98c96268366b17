package com.example.shadowbrook.game.service;

import java.util.List;

import com.example.shadowbrook.game.domain.GamePhase;

public record NarrativeContext(
        GamePhase phase,
        int dayNumber,
        int alivePlayers,
        List<String> previousEvents,
        String customPrompt) {
}
