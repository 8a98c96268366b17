package com.example.shadowbrook.game.dto.response;

public record NarrativeResponse(String narrative) {
}
