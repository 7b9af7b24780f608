package com.videopipe.orchestrator.service.adapter;

import com.videopipe.orchestrator.service.error.StageException;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.math.BigDecimal;
import java.util.Map;

/**
 * 외부 작업 상태 조회 결과: Pending(percent) | Succeeded(asset) | Failed(error)
 */
@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class PollResult {

    public enum Status { PENDING, SUCCEEDED, FAILED }

    private final Status status;
    private final int percent;
    private final String assetRef;
    private final BigDecimal costDelta;
    private final Map<String, String> outputs;   // 다음 단계 입력으로 병합할 값
    private final StageException error;

    public static PollResult pending(int percent) {
        return new PollResult(Status.PENDING, Math.max(0, Math.min(99, percent)), null, null, Map.of(), null);
    }

    public static PollResult succeeded(String assetRef, BigDecimal costDelta) {
        return succeeded(assetRef, costDelta, Map.of());
    }

    public static PollResult succeeded(String assetRef, BigDecimal costDelta, Map<String, String> outputs) {
        return new PollResult(Status.SUCCEEDED, 100, assetRef,
                costDelta == null ? BigDecimal.ZERO : costDelta, Map.copyOf(outputs), null);
    }

    public static PollResult failed(StageException error) {
        return new PollResult(Status.FAILED, 0, null, BigDecimal.ZERO, Map.of(), error);
    }

    public boolean isPending() {
        return status == Status.PENDING;
    }
}
