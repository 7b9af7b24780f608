package com.videopipe.orchestrator.service.retry;

import com.videopipe.common.enums.StageType;
import com.videopipe.common.exception.ApiException;
import com.videopipe.orchestrator.config.PipelineProperties;
import com.videopipe.orchestrator.service.error.ModerationRejectedException;
import com.videopipe.orchestrator.service.error.RetryableStageException;
import com.videopipe.orchestrator.service.error.StageException;
import com.videopipe.orchestrator.service.error.TerminalStageException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeoutException;
import java.util.function.DoubleSupplier;

/**
 * 지수 백오프 + 지터 재시도 정책
 * delay = min(base * multiplier^(attempt-1), max) * (1 ± jitterRatio), 최대 max 로 제한
 */
@Slf4j
@Component
public class ExponentialBackoffRetryPolicy implements RetryPolicy {

    private final PipelineProperties properties;
    private final DoubleSupplier random;

    @Autowired
    public ExponentialBackoffRetryPolicy(PipelineProperties properties) {
        this(properties, () -> ThreadLocalRandom.current().nextDouble());
    }

    ExponentialBackoffRetryPolicy(PipelineProperties properties, DoubleSupplier random) {
        this.properties = properties;
        this.random = random;
    }

    @Override
    public ErrorClassification classify(Throwable error) {
        Throwable cause = unwrap(error);

        if (cause instanceof ModerationRejectedException) {
            return ErrorClassification.MODERATION_REJECTED;
        }
        if (cause instanceof RetryableStageException) {
            return ErrorClassification.RETRYABLE;
        }
        if (cause instanceof TerminalStageException) {
            return ErrorClassification.TERMINAL;
        }
        if (cause instanceof StageException stageException && stageException.getStatusCode() != null) {
            return classifyStatus(stageException.getStatusCode());
        }
        if (cause instanceof ApiException || cause instanceof IllegalArgumentException) {
            return ErrorClassification.TERMINAL;
        }
        if (cause instanceof TimeoutException || cause instanceof IOException || cause instanceof UncheckedIOException) {
            return ErrorClassification.RETRYABLE;
        }

        // 분류되지 않은 오류는 일시적인 것으로 보고 시도 횟수 안에서 재시도
        log.debug("[RetryPolicy] Unclassified error treated as retryable: {}", cause.getClass().getSimpleName());
        return ErrorClassification.RETRYABLE;
    }

    private ErrorClassification classifyStatus(int statusCode) {
        if (statusCode == 408 || statusCode == 425 || statusCode == 429 || statusCode >= 500) {
            return ErrorClassification.RETRYABLE;
        }
        return ErrorClassification.TERMINAL;
    }

    @Override
    public Duration nextDelay(StageType stage, int attempt) {
        PipelineProperties.Retry retry = properties.getRetry();
        long baseMs = retry.getBaseDelay().toMillis();
        long maxMs = retry.getMaxDelay().toMillis();

        double exponential = baseMs * Math.pow(retry.getMultiplier(), Math.max(0, attempt - 1));
        double capped = Math.min(exponential, maxMs);

        // random() ∈ [0,1) → 지터 ∈ [-ratio, +ratio)
        double jitter = capped * retry.getJitterRatio() * (random.getAsDouble() * 2 - 1);
        long delayMs = Math.max(0, Math.min(maxMs, Math.round(capped + jitter)));

        return Duration.ofMillis(delayMs);
    }

    @Override
    public int maxAttempts(StageType stage) {
        return properties.maxAttemptsOf(stage);
    }

    private Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
