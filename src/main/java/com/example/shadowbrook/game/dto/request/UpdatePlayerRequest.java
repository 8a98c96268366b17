package com.example.shadowbrook.game.dto.request;

import jakarta.validation.constraints.Size;

public record UpdatePlayerRequest(@Size(max = 30) String name, Boolean ready) {
}
