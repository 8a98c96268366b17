package com.example.shadowbrook.game.service;

import java.util.Set;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * 진행 중인 게임의 안내용 카운트다운. 시간이 0 이 되어도 페이즈는 호스트가 넘깁니다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
@ConditionalOnProperty(name = "mafia.timer.enabled", havingValue = "true", matchIfMissing = true)
public class GameTimerService {

    private final GameService gameService;

    @Scheduled(fixedRateString = "${mafia.timer.tick-ms:1000}")
    public void updateAllGameTimers() {
        Set<String> activeGameIds = gameService.getActiveGameIds();
        if (activeGameIds.isEmpty()) {
            return;
        }

        for (String gameId : activeGameIds) {
            try {
                gameService.tickTimer(gameId);
            } catch (RuntimeException e) {
                log.error("게임 타이머 업데이트 중 오류 발생: {}", gameId, e);
            }
        }
    }
}
