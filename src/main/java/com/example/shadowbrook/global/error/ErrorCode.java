package com.example.shadowbrook.global.error;

import lombok.Getter;
import org.springframework.http.HttpStatus;

@Getter
public enum ErrorCode {
    INVALID_REQUEST(ErrorType.VALIDATION, HttpStatus.BAD_REQUEST, "Invalid request"),
    GAME_NOT_JOINABLE(ErrorType.VALIDATION, HttpStatus.BAD_REQUEST, "Cannot join game at this time"),
    GAME_FULL(ErrorType.VALIDATION, HttpStatus.BAD_REQUEST, "Game is full"),
    NOT_ENOUGH_PLAYERS(ErrorType.VALIDATION, HttpStatus.BAD_REQUEST, "Need at least 4 players to start"),
    PLAYERS_NOT_READY(ErrorType.VALIDATION, HttpStatus.BAD_REQUEST, "All players must be ready"),
    WRONG_PHASE(ErrorType.VALIDATION, HttpStatus.BAD_REQUEST, "Operation not allowed in the current phase"),
    GAME_ALREADY_ENDED(ErrorType.VALIDATION, HttpStatus.BAD_REQUEST, "Game has already ended"),
    NOT_HOST(ErrorType.VALIDATION, HttpStatus.BAD_REQUEST, "Only the host can do this"),
    PLAYER_NOT_ALIVE(ErrorType.VALIDATION, HttpStatus.BAD_REQUEST, "Player is not alive"),
    PLAYER_NOT_IN_GAME(ErrorType.VALIDATION, HttpStatus.BAD_REQUEST, "Player does not belong to this game"),
    INVALID_ACTION_FOR_ROLE(ErrorType.VALIDATION, HttpStatus.BAD_REQUEST, "Invalid action for your role"),
    INVALID_TARGET(ErrorType.VALIDATION, HttpStatus.BAD_REQUEST, "Invalid target"),
    INVALID_SETTINGS(ErrorType.VALIDATION, HttpStatus.BAD_REQUEST, "Invalid game settings"),
    NARRATOR_NOT_CONFIGURED(ErrorType.VALIDATION, HttpStatus.BAD_REQUEST, "Game not found or AI not configured"),

    GAME_NOT_FOUND(ErrorType.NOT_FOUND, HttpStatus.NOT_FOUND, "Game not found"),
    PLAYER_NOT_FOUND(ErrorType.NOT_FOUND, HttpStatus.NOT_FOUND, "Player not found"),

    STORAGE_UNAVAILABLE(ErrorType.COLLABORATOR_FAILURE, HttpStatus.SERVICE_UNAVAILABLE, "Storage is unavailable, please retry"),

    ROOM_CODE_EXHAUSTED(ErrorType.INTERNAL, HttpStatus.INTERNAL_SERVER_ERROR, "Failed to allocate a room code"),
    INTERNAL_SERVER_ERROR(ErrorType.INTERNAL, HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error"),
    ;

    private final ErrorType type;
    private final HttpStatus status;
    private final String message;

    ErrorCode(ErrorType type, HttpStatus status, String message) {
        this.type = type;
        this.status = status;
        this.message = message;
    }

    public String getCode() {
        return name();
    }

    public CommonException commonException() {
        return new CommonException(this);
    }

    public CommonException commonException(String detail) {
        return new CommonException(this, detail);
    }
}
