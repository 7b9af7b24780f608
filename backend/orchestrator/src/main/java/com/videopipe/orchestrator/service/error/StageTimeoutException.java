package com.videopipe.orchestrator.service.error;

import java.time.Duration;

/**
 * 단계 호출 마감 시간 초과. 재시도 대상이다.
 */
public class StageTimeoutException extends RetryableStageException {

    public StageTimeoutException(Duration timeout) {
        super("Stage call exceeded deadline of " + timeout.toMillis() + "ms", null, false, null);
    }
}
