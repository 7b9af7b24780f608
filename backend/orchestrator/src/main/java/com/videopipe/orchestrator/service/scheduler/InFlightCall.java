package com.videopipe.orchestrator.service.scheduler;

import com.videopipe.common.enums.StageType;
import com.videopipe.orchestrator.service.adapter.PollResult;
import com.videopipe.orchestrator.service.adapter.StageAdapter;
import com.videopipe.orchestrator.service.adapter.StageInput;
import com.videopipe.orchestrator.service.adapter.TaskHandle;
import lombok.Getter;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledFuture;
import java.util.function.IntConsumer;

/**
 * 진행 중인 외부 단계 호출. future 는 성공/실패/포기 중 하나로 정확히 한 번 완료된다.
 */
@Getter
class InFlightCall {

    private final String key;
    private final StageInput input;
    private final StageAdapter adapter;
    private final Duration timeout;
    private final Instant deadline;
    private final LocalDateTime startedAt = LocalDateTime.now();
    private final long startNanos = System.nanoTime();
    private final CompletableFuture<CallOutcome> future = new CompletableFuture<>();
    private final IntConsumer progressListener;

    private volatile TaskHandle handle;
    private volatile ScheduledFuture<?> watchdog;
    private volatile boolean abandoned;
    private volatile int lastPercent = -1;

    InFlightCall(String key, StageInput input, StageAdapter adapter, Duration timeout, IntConsumer progressListener) {
        this.key = key;
        this.input = input;
        this.adapter = adapter;
        this.timeout = timeout;
        this.deadline = Instant.now().plus(timeout);
        this.progressListener = progressListener;
    }

    StageType getStage() {
        return input.getStage();
    }

    int getAttempt() {
        return input.getAttempt();
    }

    String getSceneJobId() {
        return input.getSceneJobId();
    }

    boolean isDone() {
        return future.isDone();
    }

    void setHandle(TaskHandle handle) {
        this.handle = handle;
    }

    void setWatchdog(ScheduledFuture<?> watchdog) {
        this.watchdog = watchdog;
    }

    boolean succeed(PollResult result) {
        return complete(CallOutcome.succeeded(result, elapsedMs()));
    }

    boolean fail(Throwable error) {
        return complete(CallOutcome.failed(error, elapsedMs()));
    }

    /**
     * 취소로 결과를 더 이상 기다리지 않음
     *
     * @return 이 호출로 완료 처리되었으면 true
     */
    boolean abandon() {
        if (future.isDone()) {
            return false;
        }
        abandoned = true;
        return complete(CallOutcome.abandoned(elapsedMs()));
    }

    void reportProgress(int percent) {
        if (percent != lastPercent && !future.isDone()) {
            lastPercent = percent;
            progressListener.accept(percent);
        }
    }

    private boolean complete(CallOutcome outcome) {
        boolean completed = future.complete(outcome);
        ScheduledFuture<?> timer = watchdog;
        if (completed && timer != null) {
            timer.cancel(false);
        }
        return completed;
    }

    private long elapsedMs() {
        return (System.nanoTime() - startNanos) / 1_000_000;
    }
}
