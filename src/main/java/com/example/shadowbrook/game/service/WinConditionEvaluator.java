package com.example.shadowbrook.game.service;

import java.util.Map;
import java.util.Optional;

import com.example.shadowbrook.game.domain.Players;
import com.example.shadowbrook.game.domain.Team;
import org.springframework.stereotype.Component;

@Component
public class WinConditionEvaluator {

    /**
     * 게임 종료 조건 확인 (마피아 == 0 → 시민 승, 마피아 >= 나머지 → 마피아 승)
     */
    public Optional<Team> evaluate(Players players) {
        Map<Team, Long> alive = players.countAliveByTeam();
        long mafia = alive.getOrDefault(Team.MAFIA, 0L);
        long others = alive.getOrDefault(Team.VILLAGERS, 0L);

        if (mafia == 0) {
            return Optional.of(Team.VILLAGERS);
        }
        if (mafia >= others) {
            return Optional.of(Team.MAFIA);
        }
        return Optional.empty();
    }
}
