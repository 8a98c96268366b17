package com.example.shadowbrook.game.controller;

import com.example.shadowbrook.game.domain.Game;
import com.example.shadowbrook.game.domain.GamePlayer;
import com.example.shadowbrook.game.domain.GameState;
import com.example.shadowbrook.game.dto.request.CreateGameRequest;
import com.example.shadowbrook.game.dto.request.HostActionRequest;
import com.example.shadowbrook.game.dto.request.JoinGameRequest;
import com.example.shadowbrook.game.dto.request.NarrativeRequest;
import com.example.shadowbrook.game.dto.request.NightActionRequest;
import com.example.shadowbrook.game.dto.request.TransferHostRequest;
import com.example.shadowbrook.game.dto.request.UpdateGameRequest;
import com.example.shadowbrook.game.dto.request.VoteRequest;
import com.example.shadowbrook.game.dto.response.NarrativeResponse;
import com.example.shadowbrook.game.service.GameService;
import com.example.shadowbrook.global.dto.CommonResponse;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@Slf4j
@RestController
@RequestMapping("/api/games")
@RequiredArgsConstructor
public class GameController {

    private final GameService gameService;

    @PostMapping
    public ResponseEntity<Game> createGame(@Valid @RequestBody CreateGameRequest request) {
        Game game = gameService.createGame(request.name(), request.maxPlayers(), request.roleDistribution());
        return ResponseEntity.ok(game);
    }

    @GetMapping("/room/{roomCode}")
    public ResponseEntity<Game> getGameByRoomCode(@PathVariable String roomCode) {
        return ResponseEntity.ok(gameService.getGameByRoomCode(roomCode));
    }

    @PutMapping("/{gameId}")
    public ResponseEntity<Game> updateGame(@PathVariable String gameId,
            @Valid @RequestBody UpdateGameRequest request) {
        Game game = gameService.updateGame(gameId, request.playerId(), request.name(),
                request.maxPlayers(), request.roleDistribution());
        return ResponseEntity.ok(game);
    }

    @GetMapping("/{gameId}/state")
    public ResponseEntity<GameState> getGameState(@PathVariable String gameId) {
        return ResponseEntity.ok(gameService.getGameState(gameId));
    }

    @PostMapping("/{gameId}/join")
    public ResponseEntity<GamePlayer> joinGame(@PathVariable String gameId,
            @Valid @RequestBody JoinGameRequest request) {
        return ResponseEntity.ok(gameService.joinGame(gameId, request.name()));
    }

    @PostMapping("/{gameId}/start")
    public ResponseEntity<Game> startGame(@PathVariable String gameId,
            @RequestBody(required = false) HostActionRequest request) {
        return ResponseEntity.ok(gameService.startGame(gameId, requesterOf(request)));
    }

    @PostMapping("/{gameId}/next-phase")
    public ResponseEntity<Game> nextPhase(@PathVariable String gameId,
            @RequestBody(required = false) HostActionRequest request) {
        return ResponseEntity.ok(gameService.advancePhase(gameId, requesterOf(request)));
    }

    @PostMapping("/{gameId}/vote")
    public ResponseEntity<CommonResponse<Void>> vote(@PathVariable String gameId,
            @Valid @RequestBody VoteRequest request) {
        gameService.castVote(gameId, request.playerId(), request.targetId());
        return ResponseEntity.ok(CommonResponse.success(null, "Vote cast"));
    }

    @PostMapping("/{gameId}/action")
    public ResponseEntity<CommonResponse<Void>> action(@PathVariable String gameId,
            @Valid @RequestBody NightActionRequest request) {
        gameService.takeAction(gameId, request.playerId(), request.action(), request.targetId());
        return ResponseEntity.ok(CommonResponse.success(null, "Action recorded"));
    }

    @PostMapping("/{gameId}/narrative")
    public ResponseEntity<NarrativeResponse> narrative(@PathVariable String gameId,
            @Valid @RequestBody(required = false) NarrativeRequest request) {
        String playerId = request == null ? null : request.playerId();
        String prompt = request == null ? null : request.prompt();
        return ResponseEntity.ok(new NarrativeResponse(gameService.requestNarrative(gameId, playerId, prompt)));
    }

    @PostMapping("/{gameId}/end")
    public ResponseEntity<Game> endGame(@PathVariable String gameId,
            @RequestBody(required = false) HostActionRequest request) {
        return ResponseEntity.ok(gameService.endGame(gameId, requesterOf(request)));
    }

    @PostMapping("/{gameId}/host")
    public ResponseEntity<Game> transferHost(@PathVariable String gameId,
            @Valid @RequestBody TransferHostRequest request) {
        return ResponseEntity.ok(gameService.transferHost(gameId, request.playerId(), request.newHostId()));
    }

    @DeleteMapping("/{gameId}")
    public ResponseEntity<Void> deleteGame(@PathVariable String gameId,
            @RequestParam(required = false) String playerId) {
        gameService.deleteGame(gameId, playerId);
        return ResponseEntity.noContent().build();
    }

    private String requesterOf(HostActionRequest request) {
        return request == null ? null : request.playerId();
    }
}
