package com.videopipe.orchestrator.service.scheduler;

import com.videopipe.orchestrator.config.PipelineProperties;
import com.videopipe.orchestrator.service.adapter.PollResult;
import com.videopipe.orchestrator.service.adapter.StageAdapter;
import com.videopipe.orchestrator.service.adapter.StageInput;
import com.videopipe.orchestrator.service.adapter.TaskHandle;
import com.videopipe.orchestrator.service.error.RetryableStageException;
import com.videopipe.orchestrator.service.error.StageTimeoutException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.IntConsumer;

/**
 * 어댑터 호출을 비동기로 진행: submit → 주기적 poll → 완료/실패, 마감 시간 초과 시 실패 처리.
 * 호출 스레드를 막지 않는다.
 * 타이머 스레드는 예약만 하고, 어댑터 호출과 결과 처리는 워커에서, 벤더 취소는 전용 풀에서 실행한다.
 */
@Slf4j
@Component
public class StageCallRunner {

    private final ExecutorService workers;
    private final ExecutorService cancellers;
    private final ScheduledExecutorService timer;
    private final PipelineProperties properties;

    public StageCallRunner(@Qualifier("stageWorkerExecutor") ExecutorService workers,
                           @Qualifier("stageCancelExecutor") ExecutorService cancellers,
                           @Qualifier("pipelineTimer") ScheduledExecutorService timer,
                           PipelineProperties properties) {
        this.workers = workers;
        this.cancellers = cancellers;
        this.timer = timer;
        this.properties = properties;
    }

    InFlightCall start(StageAdapter adapter, StageInput input, String key, IntConsumer progressListener) {
        InFlightCall call = new InFlightCall(key, input, adapter, properties.timeoutOf(input.getStage()), progressListener);
        try {
            call.setWatchdog(timer.schedule(() -> onDeadline(call), call.getTimeout().toMillis(), TimeUnit.MILLISECONDS));
            workers.execute(() -> submit(call));
        } catch (RejectedExecutionException e) {
            call.fail(new RetryableStageException("Stage executor rejected the call", null, false, e));
        }
        return call;
    }

    /**
     * 진행 중인 호출 포기 + 벤더 작업 취소 (best-effort)
     */
    void cancel(InFlightCall call) {
        if (!call.abandon()) {
            return;
        }
        if (call.getHandle() != null) {
            requestVendorCancel(call);
        }
    }

    private void submit(InFlightCall call) {
        if (call.isDone()) {
            return;
        }
        try {
            TaskHandle handle = call.getAdapter().submit(call.getInput());
            call.setHandle(handle);
        } catch (RuntimeException e) {
            call.fail(e);
            return;
        }

        // submit 도중 취소되거나 마감된 경우 벤더 작업도 정리
        if (call.isDone()) {
            requestVendorCancel(call);
            return;
        }
        poll(call);
    }

    private void poll(InFlightCall call) {
        if (call.isDone()) {
            return;
        }

        PollResult result;
        try {
            result = call.getAdapter().poll(call.getHandle());
        } catch (RuntimeException e) {
            call.fail(e);
            return;
        }

        switch (result.getStatus()) {
            case PENDING -> {
                call.reportProgress(result.getPercent());
                schedulePoll(call);
            }
            case SUCCEEDED -> call.succeed(result);
            case FAILED -> call.fail(result.getError() != null
                    ? result.getError()
                    : new RetryableStageException("Adapter reported failure without detail"));
        }
    }

    private void schedulePoll(InFlightCall call) {
        try {
            timer.schedule(() -> {
                try {
                    workers.execute(() -> poll(call));
                } catch (RejectedExecutionException e) {
                    call.fail(new RetryableStageException("Stage executor rejected the poll", null, false, e));
                }
            }, properties.getPollInterval().toMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            call.fail(new RetryableStageException("Poll timer rejected the call", null, false, e));
        }
    }

    /**
     * 타이머 스레드에서 호출됨. 실패 처리(결과 저장/발행 포함)는 워커로 넘긴다.
     */
    private void onDeadline(InFlightCall call) {
        if (call.isDone()) {
            return;
        }
        try {
            workers.execute(() -> expire(call));
        } catch (RejectedExecutionException e) {
            expire(call);
        }
    }

    private void expire(InFlightCall call) {
        if (call.fail(new StageTimeoutException(call.getTimeout()))) {
            log.warn("[CallRunner] {} call {} (attempt {}) exceeded deadline {}ms",
                    call.getStage(), call.getKey(), call.getAttempt(), call.getTimeout().toMillis());
            if (call.getHandle() != null) {
                requestVendorCancel(call);
            }
        }
    }

    private void requestVendorCancel(InFlightCall call) {
        try {
            cancellers.execute(() -> cancelQuietly(call));
        } catch (RejectedExecutionException e) {
            log.warn("[CallRunner] Could not schedule cancel for {} {}", call.getStage(), call.getKey());
        }
    }

    private void cancelQuietly(InFlightCall call) {
        try {
            call.getAdapter().cancel(call.getHandle());
        } catch (RuntimeException e) {
            log.warn("[CallRunner] Vendor cancel failed for {} {}: {}", call.getStage(), call.getKey(), e.getMessage());
        }
    }
}
