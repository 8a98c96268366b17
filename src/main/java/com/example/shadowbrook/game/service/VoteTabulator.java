package com.example.shadowbrook.game.service;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

import com.example.shadowbrook.game.domain.GamePlayer;
import com.example.shadowbrook.game.domain.Players;
import org.springframework.stereotype.Component;

@Component
public class VoteTabulator {

    /**
     * 살아있는 투표자의 표만 집계합니다. 최다 득표자가 둘 이상이면 아무도 처형하지 않습니다.
     */
    public VoteResult tabulate(Players players) {
        Map<String, Long> tally = players.findAllAlivePlayers().stream()
                .map(GamePlayer::getVotedFor)
                .filter(Objects::nonNull)
                .collect(Collectors.groupingBy(targetId -> targetId, Collectors.counting()));

        if (tally.isEmpty()) {
            return new VoteResult(null, tally);
        }

        long max = Collections.max(tally.values());
        List<String> topVoted = tally.entrySet().stream()
                .filter(entry -> entry.getValue() == max)
                .map(Map.Entry::getKey)
                .toList();

        if (topVoted.size() != 1) {
            return new VoteResult(null, tally);
        }
        return new VoteResult(topVoted.get(0), tally);
    }

    public record VoteResult(String eliminatedId, Map<String, Long> tally) {

        public boolean hasElimination() {
            return eliminatedId != null;
        }

        public boolean isTie() {
            return eliminatedId == null && !tally.isEmpty();
        }
    }
}
