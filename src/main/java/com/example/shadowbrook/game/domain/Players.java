package com.example.shadowbrook.game.domain;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

import lombok.RequiredArgsConstructor;

@RequiredArgsConstructor
public class Players {

    private final List<GamePlayer> players;

    /**
     * 플레이어 목록 전체를 반환합니다.
     */
    public List<GamePlayer> getAsList() {
        return Collections.unmodifiableList(players); // 외부에서 수정 불가
    }

    /**
     * ID로 특정 플레이어를 찾습니다.
     */
    public Optional<GamePlayer> findById(String playerId) {
        if (playerId == null) {
            return Optional.empty();
        }
        return players.stream()
                .filter(player -> playerId.equals(player.getId()))
                .findFirst();
    }

    /**
     * 살아있는 모든 플레이어를 반환합니다.
     */
    public List<GamePlayer> findAllAlivePlayers() {
        return players.stream()
                .filter(GamePlayer::isAlive)
                .collect(Collectors.toList());
    }

    /**
     * 살아있는 플레이어를 진영별로 셉니다. 역할이 없는 플레이어는 시민 진영으로 계산합니다.
     */
    public Map<Team, Long> countAliveByTeam() {
        return players.stream()
                .filter(GamePlayer::isAlive)
                .collect(Collectors.groupingBy(
                        player -> player.getRole() == null ? Team.VILLAGERS : player.getRole().getTeam(),
                        Collectors.counting()));
    }

    public Optional<GamePlayer> findHost() {
        return players.stream().filter(GamePlayer::isHost).findFirst();
    }

    public boolean allReady() {
        return players.stream().allMatch(GamePlayer::isReady);
    }

    /**
     * 모든 플레이어의 투표 수와 투표 대상을 초기화합니다.
     */
    public void resetVotes() {
        for (GamePlayer player : players) {
            player.setVotes(0);
            player.setVotedFor(null);
        }
    }

    /**
     * 모든 플레이어의 밤 행동을 초기화합니다.
     */
    public void clearNightActions() {
        for (GamePlayer player : players) {
            player.setLastAction(null);
            player.setActionTarget(null);
        }
    }

    public int size() {
        return players.size();
    }
}
