package com.videopipe.orchestrator.config;

import com.videopipe.orchestrator.service.scheduler.PipelineScheduler;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * 기동 시 미완료 작업 재개
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "pipeline.recover-on-startup", havingValue = "true", matchIfMissing = true)
public class StartupRecoveryRunner implements ApplicationRunner {

    private final PipelineScheduler scheduler;

    @Override
    public void run(ApplicationArguments args) {
        int resumed = scheduler.recover();
        if (resumed > 0) {
            log.info("[Recovery] Resumed {} unfinished pipeline job(s)", resumed);
        }
    }
}
