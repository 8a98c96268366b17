package com.example.shadowbrook.global.error;

public enum ErrorType {
    VALIDATION, // 선행 조건 위반
    NOT_FOUND, // 세션/플레이어/메시지 없음
    COLLABORATOR_FAILURE, // 저장소 또는 내레이터 오류
    INTERNAL // 예상하지 못한 불변식 위반
}
