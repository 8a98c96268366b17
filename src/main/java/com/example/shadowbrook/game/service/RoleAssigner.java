package com.example.shadowbrook.game.service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

import com.example.shadowbrook.game.domain.GamePlayer;
import com.example.shadowbrook.game.domain.PlayerRole;
import org.springframework.stereotype.Component;

@Component
public class RoleAssigner {

    /**
     * 플레이어를 섞은 뒤 분배표 순서대로 역할을 채웁니다.
     * 분배 합계보다 플레이어가 많으면 남은 플레이어는 배정 결과에 포함되지 않습니다.
     */
    public List<RoleAssignment> assign(List<GamePlayer> players, Map<PlayerRole, Integer> distribution, Random random) {
        List<GamePlayer> shuffled = new ArrayList<>(players);
        Collections.shuffle(shuffled, random);

        // EnumMap 으로 옮겨 역할 순서를 고정
        Map<PlayerRole, Integer> ordered = new EnumMap<>(PlayerRole.class);
        ordered.putAll(distribution);

        List<RoleAssignment> assignments = new ArrayList<>();
        int playerIndex = 0;
        for (Map.Entry<PlayerRole, Integer> entry : ordered.entrySet()) {
            int count = entry.getValue() == null ? 0 : entry.getValue();
            for (int i = 0; i < count && playerIndex < shuffled.size(); i++) {
                assignments.add(new RoleAssignment(shuffled.get(playerIndex).getId(), entry.getKey()));
                playerIndex++;
            }
        }
        return assignments;
    }

    /**
     * 인원수 기준 기본 분배. 마피아는 3명당 1명, 의사와 탐정은 1명씩.
     */
    public Map<PlayerRole, Integer> defaultDistribution(int playerCount) {
        int mafiaCount = Math.max(1, playerCount / 3);
        int villagerCount = Math.max(1, playerCount - mafiaCount - 2);

        Map<PlayerRole, Integer> distribution = new EnumMap<>(PlayerRole.class);
        distribution.put(PlayerRole.VILLAGER, villagerCount);
        distribution.put(PlayerRole.DOCTOR, 1);
        distribution.put(PlayerRole.DETECTIVE, 1);
        distribution.put(PlayerRole.MAFIA, mafiaCount);
        return distribution;
    }

    /**
     * 설정된 분배표가 인원수 안에 들어오면 그대로, 아니면 기본 분배를 사용합니다.
     */
    public Map<PlayerRole, Integer> resolveDistribution(Map<PlayerRole, Integer> configured, int playerCount) {
        if (configured == null || configured.isEmpty() || sum(configured) > playerCount) {
            return defaultDistribution(playerCount);
        }
        return configured;
    }

    public static int sum(Map<PlayerRole, Integer> distribution) {
        if (distribution == null) {
            return 0;
        }
        return distribution.values().stream()
                .mapToInt(count -> count == null ? 0 : count)
                .sum();
    }

    public record RoleAssignment(String playerId, PlayerRole role) {
    }
}
