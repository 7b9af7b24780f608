package com.videopipe.orchestrator.config;

import com.videopipe.common.enums.StageType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 스케줄러용 스레드 풀
 * - stageWorkerExecutor: 어댑터 submit/poll 호출, 결과 처리 (단계 한도 합계 + 여유분)
 * - stageCancelExecutor: 벤더 취소 요청 (느린 취소가 워커를 점유하지 않도록 분리)
 * - pipelineTimer: 백오프 재시도, 폴링/마감 예약만 담당 (블로킹 작업 금지)
 * - progressStreamTimer: SSE 드레인/하트비트 전송
 */
@Slf4j
@Configuration
public class ExecutorConfig {

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService stageWorkerExecutor(PipelineProperties properties) {
        int threads = 2;
        for (StageType stage : StageType.values()) {
            threads += properties.concurrencyOf(stage);
        }
        log.info("[Executor] Stage worker pool size: {}", threads);
        return Executors.newFixedThreadPool(threads, namedThreadFactory("stage-worker"));
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService stageCancelExecutor() {
        return Executors.newCachedThreadPool(namedThreadFactory("stage-cancel"));
    }

    @Bean(destroyMethod = "shutdownNow")
    public ScheduledExecutorService pipelineTimer() {
        return Executors.newScheduledThreadPool(2, namedThreadFactory("pipeline-timer"));
    }

    @Bean(destroyMethod = "shutdownNow")
    public ScheduledExecutorService progressStreamTimer() {
        return Executors.newScheduledThreadPool(2, namedThreadFactory("progress-stream"));
    }

    public static ThreadFactory namedThreadFactory(String prefix) {
        AtomicInteger counter = new AtomicInteger(1);
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.getAndIncrement());
            thread.setDaemon(true);
            return thread;
        };
    }
}
