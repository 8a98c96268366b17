package com.example.shadowbrook.game.service;

import java.util.List;

public record GameSummary(
        String winner,
        String summary,
        List<String> keyMoments) {
}
