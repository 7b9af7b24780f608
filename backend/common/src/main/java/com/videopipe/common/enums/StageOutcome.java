package com.videopipe.common.enums;

/**
 * 단계 호출 결과 (감사 기록용)
 */
public enum StageOutcome {
    SUCCESS,
    RETRYABLE_FAILURE,
    TERMINAL_FAILURE,
    MODERATION_REJECTED,
    /** 취소 또는 재시작으로 결과를 받지 못한 호출 */
    ABANDONED
}
