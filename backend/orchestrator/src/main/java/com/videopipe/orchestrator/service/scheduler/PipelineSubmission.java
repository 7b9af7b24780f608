package com.videopipe.orchestrator.service.scheduler;

import lombok.Builder;
import lombok.Getter;
import lombok.Singular;

import java.math.BigDecimal;
import java.util.List;

/**
 * 스케줄러에 제출하는 작업 정의 (이미 씬 단위로 분해된 스크립트)
 */
@Getter
@Builder
public class PipelineSubmission {
    private final String scriptRef;
    private final String scriptTitle;
    private final String idempotencyKey;
    @Singular
    private final List<String> sceneTexts;
    private final Boolean allowPartialAssembly;   // null 이면 설정값 사용
    private final BigDecimal costBudget;          // null 이면 설정값 사용
}
