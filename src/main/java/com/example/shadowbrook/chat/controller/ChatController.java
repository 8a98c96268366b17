package com.example.shadowbrook.chat.controller;

import com.example.shadowbrook.chat.domain.ChatMessage;
import com.example.shadowbrook.chat.dto.ChatMessageRequest;
import com.example.shadowbrook.chat.service.ChatService;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/games")
@RequiredArgsConstructor
public class ChatController {

    private final ChatService chatService;

    @PostMapping("/{gameId}/chat")
    public ResponseEntity<ChatMessage> sendMessage(@PathVariable String gameId,
            @Valid @RequestBody ChatMessageRequest request) {
        ChatMessage message = chatService.postMessage(gameId, request.playerId(), request.message(),
                request.systemMessage());
        return ResponseEntity.ok(message);
    }
}
