package com.example.shadowbrook.game.service;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import com.example.shadowbrook.game.domain.GamePlayer;
import com.example.shadowbrook.game.domain.NightActionType;
import com.example.shadowbrook.game.domain.PlayerRole;
import com.example.shadowbrook.game.domain.Players;
import org.springframework.stereotype.Component;

/**
 * 밤 행동 결과 계산. 의사 보호 → 마피아 공격 → 탐정 조사 순으로 처리합니다.
 */
@Component
public class NightActionResolver {

    static final String PROTECTED_EVENT = "The doctor protected someone from harm.";
    static final String ELIMINATED_EVENT = "A villager was found eliminated at dawn.";
    static final String SURVIVED_EVENT = "Someone was attacked but miraculously survived.";
    static final String INVESTIGATED_EVENT = "The detective gathered crucial information.";

    public NightResolution resolve(Players players) {
        List<GamePlayer> actors = players.findAllAlivePlayers().stream()
                .filter(player -> player.getLastAction() != null && player.getActionTarget() != null)
                .toList();

        List<String> events = new ArrayList<>();
        Set<String> protectedIds = new LinkedHashSet<>();
        Set<String> eliminatedIds = new LinkedHashSet<>();
        List<InvestigationResult> investigations = new ArrayList<>();

        for (GamePlayer doctor : actorsOf(actors, PlayerRole.DOCTOR, NightActionType.HEAL)) {
            protectedIds.add(doctor.getActionTarget());
            events.add(PROTECTED_EVENT);
        }

        // 공격자마다 같은 보호 목록을 기준으로 독립 판정
        for (GamePlayer mafia : actorsOf(actors, PlayerRole.MAFIA, NightActionType.KILL)) {
            if (protectedIds.contains(mafia.getActionTarget())) {
                events.add(SURVIVED_EVENT);
            } else {
                eliminatedIds.add(mafia.getActionTarget());
                events.add(ELIMINATED_EVENT);
            }
        }

        for (GamePlayer detective : actorsOf(actors, PlayerRole.DETECTIVE, NightActionType.INVESTIGATE)) {
            events.add(INVESTIGATED_EVENT);
            players.findById(detective.getActionTarget()).ifPresent(target -> investigations.add(
                    new InvestigationResult(detective.getId(), target.getId(), target.getName(), target.getRole())));
        }

        return new NightResolution(events, eliminatedIds, protectedIds, investigations);
    }

    private List<GamePlayer> actorsOf(List<GamePlayer> actors, PlayerRole role, NightActionType action) {
        return actors.stream()
                .filter(player -> player.getRole() == role && player.getLastAction() == action)
                .toList();
    }

    public record NightResolution(
            List<String> events,
            Set<String> eliminatedIds,
            Set<String> protectedIds,
            List<InvestigationResult> investigations) {
    }

    /**
     * 탐정에게만 전달되는 조사 결과
     */
    public record InvestigationResult(String detectiveId, String targetId, String targetName, PlayerRole targetRole) {
    }
}
