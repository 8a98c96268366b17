package com.example.shadowbrook.game.service;

import java.util.List;
import java.util.Locale;
import java.util.Map;

import com.example.shadowbrook.game.domain.Team;
import com.example.shadowbrook.global.client.GeminiApiClient;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * 내레이션 생성. 외부 API 가 실패해도 항상 문구를 반환합니다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class NarrativeService {

    public static final String OPENING_NARRATIVE = "The game begins in the mysterious village of Shadowbrook. "
            + "As night falls, an ominous feeling settles over the residents...";
    static final String DEFAULT_NARRATIVE =
            "The village of Shadowbrook remains shrouded in mystery as the game continues...";

    private static final String SETTING =
            "You are the narrator of a Mafia game set in the mysterious village of Shadowbrook.";

    private static final Map<String, Object> SUMMARY_SCHEMA = Map.of(
            "type", "object",
            "properties", Map.of(
                    "winner", Map.of("type", "string"),
                    "summary", Map.of("type", "string"),
                    "keyMoments", Map.of("type", "array", "items", Map.of("type", "string"))),
            "required", List.of("winner", "summary", "keyMoments"));

    private final GeminiApiClient geminiApiClient;
    private final ObjectMapper objectMapper;

    public boolean isAvailable() {
        return geminiApiClient.isConfigured();
    }

    public String generateNarrative(NarrativeContext context) {
        String text = geminiApiClient.generateContent(buildPrompt(context));
        if (text == null) {
            return DEFAULT_NARRATIVE;
        }
        return text.trim();
    }

    /**
     * 게임 종료 요약. JSON 응답을 파싱하지 못하면 기본 요약을 사용합니다.
     */
    public GameSummary generateSummary(Team winner, int playerCount, List<String> events) {
        String prompt = """
                You are concluding a Mafia game in Shadowbrook village.
                Winner: %s
                Total players: %d
                Game events: %s

                Generate a dramatic conclusion narrative and identify 3 key moments from the game.
                Respond with JSON in this format:
                {
                  "winner": "%s",
                  "summary": "A dramatic 2-3 sentence conclusion narrative",
                  "keyMoments": ["moment1", "moment2", "moment3"]
                }""".formatted(winner, playerCount, String.join(", ", events), winner);

        String json = geminiApiClient.generateJson(prompt, SUMMARY_SCHEMA);
        if (json == null) {
            return fallbackSummary(winner);
        }
        try {
            GameSummary summary = objectMapper.readValue(json, GameSummary.class);
            if (summary.summary() == null || summary.summary().isBlank()) {
                log.warn("Game summary without text, using fallback");
                return fallbackSummary(winner);
            }
            return summary;
        } catch (JsonProcessingException e) {
            log.warn("Failed to parse game summary: {}", e.getMessage());
            return fallbackSummary(winner);
        }
    }

    private GameSummary fallbackSummary(Team winner) {
        String name = winner.name().toLowerCase(Locale.ROOT);
        return new GameSummary(
                winner.name(),
                "The game concludes with " + name + " emerging victorious in the shadows of Shadowbrook.",
                List.of(
                        "The game began with mystery and suspicion",
                        "Tensions rose as accusations flew",
                        "The " + name + " achieved their victory"));
    }

    String buildPrompt(NarrativeContext context) {
        String events = context.previousEvents() == null ? "" : String.join(", ", context.previousEvents());

        if (context.customPrompt() != null && !context.customPrompt().isBlank()) {
            return SETTING + "\n"
                    + "Current context: " + context.phase() + " " + context.dayNumber() + ", "
                    + context.alivePlayers() + " players.\n"
                    + "Previous events: " + events + "\n\n"
                    + "Generate a dramatic narrative based on this custom prompt: " + context.customPrompt() + "\n\n"
                    + "Keep the narrative atmospheric, mysterious, and engaging. "
                    + "Focus on the mood and setting rather than specific player actions.";
        }

        return switch (context.phase()) {
            case DAY -> SETTING + "\n"
                    + "It is Day " + context.dayNumber() + " with " + context.alivePlayers() + " players remaining.\n"
                    + "Previous events: " + events + "\n\n"
                    + "Generate a dramatic narrative for the day phase. The villagers are gathering to discuss and vote.\n"
                    + "Create an atmospheric description of the village, the tension among the residents, "
                    + "and the growing suspicion.\n"
                    + "Keep it mysterious and engaging, around 2-3 sentences.";
            case NIGHT -> SETTING + "\n"
                    + "It is Night " + context.dayNumber() + " with " + context.alivePlayers() + " players remaining.\n"
                    + "Previous events: " + events + "\n\n"
                    + "Generate a dramatic narrative for the night phase. "
                    + "Darkness falls over the village and sinister forces move in the shadows.\n"
                    + "Create an atmospheric description of the night, the fear among residents, "
                    + "and the lurking danger.\n"
                    + "Keep it mysterious and foreboding, around 2-3 sentences.";
            case VOTING -> SETTING + "\n"
                    + "It is the voting phase of Day " + context.dayNumber() + " with "
                    + context.alivePlayers() + " players remaining.\n"
                    + "Previous events: " + events + "\n\n"
                    + "Generate a dramatic narrative for the voting phase. The villagers must decide who to eliminate.\n"
                    + "Create tension around the difficult decision they face and the weight of their choice.\n"
                    + "Keep it dramatic and suspenseful, around 2-3 sentences.";
            default -> "Generate a mysterious and atmospheric narrative for a Mafia game set in Shadowbrook village.\n"
                    + "Current situation: " + context.phase() + " " + context.dayNumber() + ", "
                    + context.alivePlayers() + " players.\n"
                    + "Keep it engaging and mysterious, around 2-3 sentences.";
        };
    }
}
