package com.videopipe.orchestrator.service.error;

import lombok.Getter;

/**
 * 외부 단계 호출 실패의 공통 예외.
 * statusCode 는 벤더 응답 코드 (없으면 null)
 */
@Getter
public class StageException extends RuntimeException {

    private final Integer statusCode;

    public StageException(String message) {
        this(message, null, null);
    }

    public StageException(String message, Integer statusCode) {
        this(message, statusCode, null);
    }

    public StageException(String message, Integer statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }
}
