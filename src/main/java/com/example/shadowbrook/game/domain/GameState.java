package com.example.shadowbrook.game.domain;

import java.util.List;

import com.example.shadowbrook.chat.domain.ChatMessage;

/**
 * 실시간 갱신과 상태 조회에 쓰이는 세션 스냅샷.
 * revision 은 같은 게임 안에서 커질수록 최신 스냅샷입니다.
 */
public record GameState(
        long revision,
        Game game,
        List<GamePlayer> players,
        List<ChatMessage> chatMessages) {

    /**
     * 게임이 끝나기 전에는 살아있는 플레이어의 역할과 밤 행동을 숨깁니다.
     */
    public static GameState publicView(long revision, Game game, List<GamePlayer> players,
            List<ChatMessage> chatMessages) {
        boolean revealAll = game.getCurrentPhase() == GamePhase.ENDED;
        List<GamePlayer> visible = players.stream()
                .map(player -> revealAll || !player.isAlive() ? player : player.concealed())
                .toList();
        return new GameState(revision, game, visible, List.copyOf(chatMessages));
    }
}
