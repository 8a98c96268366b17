package com.example.shadowbrook.game.service;

import java.security.SecureRandom;
import java.util.Random;
import java.util.function.Predicate;

import com.example.shadowbrook.global.error.ErrorCode;
import org.springframework.stereotype.Component;

@Component
public class RoomCodeGenerator {

    private static final String ALPHABET = "ABCDEFGHIJKLMNOPQRSTUVWXYZ0123456789";
    static final int CODE_LENGTH = 6;
    private static final int MAX_ATTEMPTS = 20;

    private final Random random = new SecureRandom();

    /**
     * 사용 중이지 않은 6자리 방 코드를 생성합니다.
     */
    public String generate(Predicate<String> inUse) {
        for (int attempt = 0; attempt < MAX_ATTEMPTS; attempt++) {
            String code = randomCode();
            if (!inUse.test(code)) {
                return code;
            }
        }
        throw ErrorCode.ROOM_CODE_EXHAUSTED.commonException();
    }

    private String randomCode() {
        StringBuilder code = new StringBuilder(CODE_LENGTH);
        for (int i = 0; i < CODE_LENGTH; i++) {
            code.append(ALPHABET.charAt(random.nextInt(ALPHABET.length())));
        }
        return code.toString();
    }
}
