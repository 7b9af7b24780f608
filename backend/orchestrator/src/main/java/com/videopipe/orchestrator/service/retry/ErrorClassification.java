package com.videopipe.orchestrator.service.retry;

public enum ErrorClassification {
    RETRYABLE,
    TERMINAL,
    /** 같은 입력으로 재시도하지 않고 대체 입력을 한 번 시도 */
    MODERATION_REJECTED
}
