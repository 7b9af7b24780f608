package com.videopipe.orchestrator.service.retry;

import com.videopipe.common.enums.StageType;
import com.videopipe.orchestrator.config.PipelineProperties;
import com.videopipe.orchestrator.service.error.RetryableStageException;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.Map;

/**
 * 단계별 적응형 호출 간격 관리
 * - pipeline.pacing.<stage> 설정이 있는 단계만 간격을 둔다
 * - 429 는 간격 증가, 503 은 큰 폭 증가, 성공 누적 시 감소
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class StagePacingService {

    private final PipelineProperties properties;

    private final Map<StageType, AdaptiveRateLimiter> limiters = new EnumMap<>(StageType.class);

    @PostConstruct
    public void init() {
        properties.getPacing().forEach((stage, pacing) -> {
            if (pacing.getMaxDelayMs() <= 0) {
                return;
            }
            limiters.put(stage, new AdaptiveRateLimiter(
                    stage.name(),
                    pacing.getInitialDelayMs(),
                    pacing.getMinDelayMs(),
                    pacing.getMaxDelayMs(),
                    pacing.getSuccessDecreaseRatio(),
                    pacing.getErrorIncreaseRatio(),
                    pacing.getSuccessStreakForDecrease()));
        });
        log.info("[Pacing] Adaptive pacing enabled for stages: {}", limiters.keySet());
    }

    /**
     * @return 0 이면 지금 디스패치 가능, 양수면 대기해야 할 밀리초
     */
    public long tryAcquire(StageType stage) {
        AdaptiveRateLimiter limiter = limiters.get(stage);
        return limiter == null ? 0 : limiter.tryAcquire();
    }

    public void recordSuccess(StageType stage) {
        AdaptiveRateLimiter limiter = limiters.get(stage);
        if (limiter != null) {
            limiter.recordSuccess();
        }
    }

    /**
     * 실패 중 호출 속도와 관련된 것만 간격에 반영
     */
    public void recordFailure(StageType stage, Throwable error) {
        AdaptiveRateLimiter limiter = limiters.get(stage);
        if (limiter == null || !(error instanceof RetryableStageException retryable)) {
            return;
        }
        if (retryable.isThrottled()) {
            limiter.recordError();
        } else if (retryable.getStatusCode() != null && retryable.getStatusCode() == 503) {
            limiter.recordSevereError();
        }
    }

    public long currentDelayMs(StageType stage) {
        AdaptiveRateLimiter limiter = limiters.get(stage);
        return limiter == null ? 0 : limiter.getCurrentDelayMs();
    }

    @Scheduled(fixedDelayString = "${pipeline.pacing-stats-interval:PT10M}")
    public void logStats() {
        limiters.values().forEach(limiter -> log.info(limiter.getStats()));
    }
}
