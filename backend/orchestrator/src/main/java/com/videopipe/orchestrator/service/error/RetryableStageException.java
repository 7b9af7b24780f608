package com.videopipe.orchestrator.service.error;

import lombok.Getter;

/**
 * 일시적 실패 (5xx, 429, 네트워크 오류, 응답 디코딩 오류)
 */
@Getter
public class RetryableStageException extends StageException {

    /** 429 등 호출 속도 제한 신호 */
    private final boolean throttled;

    public RetryableStageException(String message) {
        this(message, null, false, null);
    }

    public RetryableStageException(String message, Integer statusCode, boolean throttled, Throwable cause) {
        super(message, statusCode, cause);
        this.throttled = throttled;
    }
}
