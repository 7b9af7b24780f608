package com.videopipe.orchestrator.service.error;

/**
 * 재시도해도 결과가 바뀌지 않는 실패 (잘못된 입력, 인증 실패 등)
 */
public class TerminalStageException extends StageException {

    public TerminalStageException(String message) {
        super(message);
    }

    public TerminalStageException(String message, Integer statusCode) {
        super(message, statusCode);
    }

    public TerminalStageException(String message, Integer statusCode, Throwable cause) {
        super(message, statusCode, cause);
    }
}
