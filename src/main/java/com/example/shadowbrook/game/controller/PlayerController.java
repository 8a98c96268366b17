package com.example.shadowbrook.game.controller;

import com.example.shadowbrook.game.domain.GamePlayer;
import com.example.shadowbrook.game.dto.request.UpdatePlayerRequest;
import com.example.shadowbrook.game.service.GameService;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/players")
@RequiredArgsConstructor
public class PlayerController {

    private final GameService gameService;

    @PutMapping("/{playerId}")
    public ResponseEntity<GamePlayer> updatePlayer(@PathVariable String playerId,
            @Valid @RequestBody UpdatePlayerRequest request) {
        return ResponseEntity.ok(gameService.updatePlayer(playerId, request.name(), request.ready()));
    }
}
