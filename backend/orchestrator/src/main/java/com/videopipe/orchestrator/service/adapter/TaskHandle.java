package com.videopipe.orchestrator.service.adapter;

import com.videopipe.common.enums.StageType;

import java.time.Instant;

/**
 * 어댑터가 발급한 외부 작업 식별자
 */
public record TaskHandle(String taskId, StageType stage, Instant submittedAt) {
}
