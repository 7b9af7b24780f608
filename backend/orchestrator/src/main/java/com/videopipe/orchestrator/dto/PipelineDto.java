package com.videopipe.orchestrator.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.videopipe.common.enums.FailureKind;
import com.videopipe.common.enums.PipelineStatus;
import com.videopipe.common.enums.SceneStage;
import com.videopipe.common.enums.StageOutcome;
import com.videopipe.common.enums.StageType;
import lombok.*;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 파이프라인 컨트롤 API DTO
 */
public class PipelineDto {

    // ========== 제출 ==========

    /**
     * 작업 제출 요청
     * scriptContent 가 있으면 그대로 파싱하고, 없으면 scriptRef 파일을 읽는다.
     */
    @Getter
    @Setter
    @NoArgsConstructor
    @AllArgsConstructor
    @Builder
    public static class SubmitRequest {
        private String scriptRef;             // scriptDir 기준 상대 경로 (file: 접두어 허용)
        private String scriptContent;         // 인라인 마크다운 스크립트 (선택)
        private String idempotencyKey;        // 같은 키로 재제출 시 기존 작업 반환
        private Boolean allowPartialAssembly; // null 이면 pipeline.assembly-policy
        private BigDecimal costBudget;        // null 이면 pipeline.cost-budget
    }

    @Getter
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class SubmitResponse {
        private String jobId;
        private PipelineStatus status;
        private int sceneCount;
    }

    // ========== 상태 조회 ==========

    @Getter
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class StatusResponse {
        private String jobId;
        private String scriptRef;
        private String scriptTitle;
        private PipelineStatus status;
        private String statusDescription;
        private boolean allowPartialAssembly;
        private BigDecimal costAccumulated;
        private BigDecimal costBudget;
        private Map<StageType, Integer> stageAttempts;
        private Map<StageType, String> stageAssets;
        private String finalAssetRef;
        private String lastError;
        private FailureKind lastErrorKind;
        private int readySceneCount;
        private int failedSceneCount;
        private List<SceneStatus> scenes;
        private LocalDateTime createdAt;
        private LocalDateTime updatedAt;
        private LocalDateTime completedAt;
    }

    @Getter
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class SceneStatus {
        private String sceneJobId;
        private Integer sceneIndex;
        private SceneStage currentStage;
        private StageType inFlightStage;
        private StageType failedStage;
        private Map<StageType, Integer> attempts;
        private Set<StageType> fallbackUsed;
        private Map<StageType, String> assets;
        private String lastError;
        private FailureKind lastErrorKind;
        private LocalDateTime updatedAt;
    }

    // ========== 재시도 ==========

    /**
     * 씬 재시도 요청 (입력 교체는 선택)
     */
    @Getter
    @Setter
    @NoArgsConstructor
    @AllArgsConstructor
    public static class SceneRetryRequest {
        private Map<String, String> inputOverrides;  // 예: narration, visualPrompt
    }

    // ========== 감사 기록 ==========

    @Getter
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class AuditRecord {
        private Long recordId;
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

    /**
     * 단계별 대기/진행 현황
     */
    @Getter
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class LaneStatus {
        private StageType stage;
        private int queued;
        private int inFlight;
        private int limit;
        private long pacingDelayMs;
    }
}
