package com.videopipe.orchestrator.service.retry;

import com.videopipe.common.enums.StageType;

import java.time.Duration;

/**
 * 실패한 단계 호출의 재시도 여부와 시점 결정
 */
public interface RetryPolicy {

    ErrorClassification classify(Throwable error);

    /**
     * @param attempt 방금 실패한 시도 번호 (1부터)
     */
    Duration nextDelay(StageType stage, int attempt);

    int maxAttempts(StageType stage);
}
