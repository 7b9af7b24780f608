package com.videopipe.orchestrator.entity;

import com.videopipe.common.enums.StageOutcome;
import com.videopipe.common.enums.StageType;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * 단계 호출 감사 기록 (불변)
 * sceneJobId 가 null 이면 파이프라인 단위 단계(ASSEMBLY, UPLOAD)
 */
@Getter
@Builder
@NoArgsConstructor(access = AccessLevel.PRIVATE)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class StageCallRecord {
    private Long recordId;
    private String pipelineJobId;
    private String sceneJobId;
    private StageType stage;
    private Integer attempt;
    private StageOutcome outcome;
    private LocalDateTime startedAt;
    private LocalDateTime endedAt;
    private Long providerLatencyMs;
    private BigDecimal costDelta;
    private String errorMessage;
}
