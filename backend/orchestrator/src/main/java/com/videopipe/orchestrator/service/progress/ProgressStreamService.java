package com.videopipe.orchestrator.service.progress;

import com.videopipe.orchestrator.config.PipelineProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 진행 이벤트 구독을 SSE 스트림으로 내보낸다.
 * 구독 큐를 주기적으로 비워 전송하므로 느린 클라이언트가 스케줄러를 막지 않는다.
 * 전송은 스케줄러 타이머와 분리된 progressStreamTimer 에서 실행한다.
 */
@Slf4j
@Service
public class ProgressStreamService {

    private final ProgressBroadcaster broadcaster;
    private final ScheduledExecutorService timer;
    private final PipelineProperties.Progress settings;

    public ProgressStreamService(ProgressBroadcaster broadcaster,
                                 @Qualifier("progressStreamTimer") ScheduledExecutorService timer,
                                 PipelineProperties properties) {
        this.broadcaster = broadcaster;
        this.timer = timer;
        this.settings = properties.getProgress();
    }

    /**
     * @param jobId null 이면 전체 작업 스트림
     */
    public SseEmitter open(String jobId) {
        SseEmitter emitter = new SseEmitter(settings.getSseTimeout().toMillis());
        ProgressSubscription subscription = jobId != null ? broadcaster.subscribe(jobId) : broadcaster.subscribeAll();
        Stream stream = new Stream(emitter, subscription);

        emitter.onCompletion(stream::close);
        emitter.onTimeout(stream::close);
        emitter.onError(error -> stream.close());

        try {
            stream.drainTask = timer.scheduleWithFixedDelay(stream::drain,
                    0, settings.getSseDrainInterval().toMillis(), TimeUnit.MILLISECONDS);
            stream.heartbeatTask = timer.scheduleWithFixedDelay(stream::heartbeat,
                    settings.getSseHeartbeatInterval().toMillis(),
                    settings.getSseHeartbeatInterval().toMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            stream.close();
            emitter.completeWithError(e);
            return emitter;
        }

        log.info("[Progress] SSE stream opened for {} (subscription {})",
                jobId != null ? "job " + jobId : "all jobs", subscription.getSubscriptionId());
        return emitter;
    }

    private class Stream {

        private final SseEmitter emitter;
        private final ProgressSubscription subscription;
        private final AtomicBoolean closed = new AtomicBoolean();
        private volatile ScheduledFuture<?> drainTask;
        private volatile ScheduledFuture<?> heartbeatTask;

        Stream(SseEmitter emitter, ProgressSubscription subscription) {
            this.emitter = emitter;
            this.subscription = subscription;
        }

        void drain() {
            if (closed.get()) {
                return;
            }
            List<ProgressEvent> events = subscription.drain();
            boolean finished = false;
            try {
                for (ProgressEvent event : events) {
                    emitter.send(SseEmitter.event()
                            .id(String.valueOf(event.getSequence()))
                            .name(event.getType().name())
                            .data(event, MediaType.APPLICATION_JSON));
                    finished |= subscription.getJobId() != null && isStreamEnd(event.getType());
                }
            } catch (IOException | IllegalStateException e) {
                log.debug("[Progress] SSE client gone ({}): {}", subscription.getSubscriptionId(), e.getMessage());
                close();
                return;
            }

            if (finished) {
                close();
                emitter.complete();
            }
        }

        void heartbeat() {
            if (closed.get()) {
                return;
            }
            try {
                emitter.send(SseEmitter.event().comment("heartbeat"));
            } catch (IOException | IllegalStateException e) {
                log.debug("[Progress] SSE heartbeat failed ({}): {}", subscription.getSubscriptionId(), e.getMessage());
                close();
            }
        }

        void close() {
            if (!closed.compareAndSet(false, true)) {
                return;
            }
            if (drainTask != null) {
                drainTask.cancel(false);
            }
            if (heartbeatTask != null) {
                heartbeatTask.cancel(false);
            }
            broadcaster.unsubscribe(subscription);
            log.debug("[Progress] SSE stream closed ({}), dropped={}",
                    subscription.getSubscriptionId(), subscription.getTotalDropped());
        }

        private boolean isStreamEnd(ProgressEventType type) {
            return type == ProgressEventType.JOB_COMPLETED || type == ProgressEventType.JOB_CANCELLED;
        }
    }
}
