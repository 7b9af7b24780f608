package com.videopipe.orchestrator.service.scheduler;

import com.videopipe.orchestrator.service.adapter.PollResult;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.time.LocalDateTime;

/**
 * 단계 호출 하나의 최종 결과
 */
@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
class CallOutcome {

    enum Status { SUCCEEDED, FAILED, ABANDONED }

    private final Status status;
    private final PollResult result;
    private final Throwable error;
    private final LocalDateTime endedAt;
    private final long latencyMs;

    static CallOutcome succeeded(PollResult result, long latencyMs) {
        return new CallOutcome(Status.SUCCEEDED, result, null, LocalDateTime.now(), latencyMs);
    }

    static CallOutcome failed(Throwable error, long latencyMs) {
        return new CallOutcome(Status.FAILED, null, error, LocalDateTime.now(), latencyMs);
    }

    static CallOutcome abandoned(long latencyMs) {
        return new CallOutcome(Status.ABANDONED, null, null, LocalDateTime.now(), latencyMs);
    }
}
