package com.videopipe.orchestrator.service.retry;

import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 적응형 호출 간격 제어
 *
 * - 429/503 응답 시 간격 증가
 * - 연속 성공 시 점진적으로 간격 감소
 * - 스케줄러 디스패치 스레드를 막지 않도록 대기 대신 남은 시간을 돌려준다
 */
@Slf4j
public class AdaptiveRateLimiter {

    private final String name;
    private final long minDelayMs;
    private final long maxDelayMs;
    private final double successDecreaseRatio;
    private final double errorIncreaseRatio;
    private final int successStreakForDecrease;

    // 현재 적용 중인 간격 (밀리초)
    private final AtomicLong currentDelayMs;

    // 마지막 호출 허용 시각
    private final AtomicLong lastCallTimeMs = new AtomicLong(0);

    private final AtomicInteger successStreak = new AtomicInteger(0);

    // 통계
    private final AtomicLong totalCalls = new AtomicLong(0);
    private final AtomicLong totalErrors = new AtomicLong(0);
    private final AtomicLong totalDeferrals = new AtomicLong(0);

    public AdaptiveRateLimiter(
            String name,
            long initialDelayMs,
            long minDelayMs,
            long maxDelayMs,
            double successDecreaseRatio,
            double errorIncreaseRatio,
            int successStreakForDecrease
    ) {
        this.name = name;
        this.minDelayMs = minDelayMs;
        this.maxDelayMs = Math.max(minDelayMs, maxDelayMs);
        this.successDecreaseRatio = successDecreaseRatio;
        this.errorIncreaseRatio = errorIncreaseRatio;
        this.successStreakForDecrease = successStreakForDecrease;
        this.currentDelayMs = new AtomicLong(Math.max(minDelayMs, Math.min(this.maxDelayMs, initialDelayMs)));

        log.info("[{}Pacing] Initialized - delay: {}ms, range: {}ms-{}ms",
                name, currentDelayMs.get(), minDelayMs, this.maxDelayMs);
    }

    /**
     * 호출 슬롯 예약 시도
     *
     * @return 0 이면 지금 호출 가능 (호출 시각 기록됨), 양수면 그만큼 뒤에 다시 시도
     */
    public long tryAcquire() {
        while (true) {
            long now = System.currentTimeMillis();
            long lastCall = lastCallTimeMs.get();
            long delay = currentDelayMs.get();
            long elapsed = now - lastCall;

            if (elapsed < delay) {
                totalDeferrals.incrementAndGet();
                return delay - elapsed;
            }
            if (lastCallTimeMs.compareAndSet(lastCall, now)) {
                totalCalls.incrementAndGet();
                return 0;
            }
        }
    }

    /**
     * 호출 성공 기록. 연속 성공 시 간격 감소
     */
    public void recordSuccess() {
        int streak = successStreak.incrementAndGet();

        if (streak >= successStreakForDecrease) {
            long oldDelay = currentDelayMs.get();
            long newDelay = Math.max(minDelayMs, (long) (oldDelay * successDecreaseRatio));

            if (currentDelayMs.compareAndSet(oldDelay, newDelay) && newDelay < oldDelay) {
                log.info("[{}Pacing] Success streak {} - delay decreased: {}ms → {}ms",
                        name, streak, oldDelay, newDelay);
                successStreak.set(0);
            }
        }
    }

    /**
     * 호출 속도 제한 응답 기록 (429). 즉시 간격 증가
     */
    public void recordError() {
        successStreak.set(0);
        totalErrors.incrementAndGet();

        long oldDelay = currentDelayMs.get();
        // 간격이 0 이면 배율만으로는 늘어나지 않으므로 최소 1초부터 시작
        long base = oldDelay > 0 ? oldDelay : Math.min(maxDelayMs, 1000);
        long newDelay = Math.min(maxDelayMs, (long) (base * errorIncreaseRatio));

        if (currentDelayMs.compareAndSet(oldDelay, newDelay) && newDelay != oldDelay) {
            log.warn("[{}Pacing] Throttled - delay increased: {}ms → {}ms", name, oldDelay, newDelay);
        }
    }

    /**
     * 심각한 과부하 (503). 더 큰 폭으로 간격 증가
     */
    public void recordSevereError() {
        successStreak.set(0);
        totalErrors.incrementAndGet();

        long oldDelay = currentDelayMs.get();
        long base = oldDelay > 0 ? oldDelay : Math.min(maxDelayMs, 1000);
        long newDelay = Math.min(maxDelayMs, (long) (base * errorIncreaseRatio * 1.5));

        if (currentDelayMs.compareAndSet(oldDelay, newDelay) && newDelay != oldDelay) {
            log.warn("[{}Pacing] Overloaded - delay increased: {}ms → {}ms", name, oldDelay, newDelay);
        }
    }

    public long getCurrentDelayMs() {
        return currentDelayMs.get();
    }

    public String getStats() {
        long calls = totalCalls.get();
        long errors = totalErrors.get();
        double errorRate = calls > 0 ? (double) errors / calls * 100 : 0;

        return String.format(
                "[%sPacing Stats] calls: %d, throttled: %d (%.1f%%), deferrals: %d, currentDelay: %dms",
                name, calls, errors, errorRate, totalDeferrals.get(), currentDelayMs.get()
        );
    }

    /**
     * 간격 수동 설정 (운영 긴급 조치용)
     */
    public void setDelay(long delayMs) {
        long bounded = Math.max(minDelayMs, Math.min(maxDelayMs, delayMs));
        currentDelayMs.set(bounded);
        log.info("[{}Pacing] Delay manually set to {}ms", name, bounded);
    }
}
