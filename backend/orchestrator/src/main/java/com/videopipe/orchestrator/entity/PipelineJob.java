package com.videopipe.orchestrator.entity;

import com.videopipe.common.enums.FailureKind;
import com.videopipe.common.enums.PipelineStatus;
import com.videopipe.common.enums.StageType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * 파이프라인 작업 엔티티
 * 하나의 스크립트로부터 최종 영상 한 편을 만드는 요청 단위
 */
@Getter
@Setter
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class PipelineJob {
    private String jobId;
    private String scriptRef;
    private String scriptTitle;
    private String idempotencyKey;
    private PipelineStatus status;
    private boolean allowPartialAssembly;  // 실패 씬 제외 합성 허용 여부
    private BigDecimal costAccumulated;
    private BigDecimal costBudget;         // null 이면 무제한
    @Builder.Default
    private List<String> sceneJobIds = new ArrayList<>();  // sceneIndex 순서
    @Builder.Default
    private Map<StageType, Integer> stageAttempts = new EnumMap<>(StageType.class);  // ASSEMBLY, UPLOAD
    @Builder.Default
    private Map<StageType, String> stageAssets = new EnumMap<>(StageType.class);
    private StageType inFlightStage;       // 호출 중인 ASSEMBLY/UPLOAD, 재시작 복구 시 ABANDONED 기록용
    private String finalAssetRef;
    private String lastError;
    private FailureKind lastErrorKind;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
    private LocalDateTime completedAt;

    public int attemptsOf(StageType stage) {
        return stageAttempts.getOrDefault(stage, 0);
    }

    public void addCost(BigDecimal delta) {
        if (delta == null || delta.signum() == 0) {
            return;
        }
        costAccumulated = (costAccumulated == null ? BigDecimal.ZERO : costAccumulated).add(delta);
    }

    public boolean isBudgetExhausted() {
        return costBudget != null && costAccumulated != null && costAccumulated.compareTo(costBudget) >= 0;
    }

    /**
     * 저장소 스냅샷용 깊은 복사
     */
    public PipelineJob copy() {
        return toBuilder()
                .sceneJobIds(new ArrayList<>(sceneJobIds))
                .stageAttempts(copyOf(stageAttempts))
                .stageAssets(copyOf(stageAssets))
                .build();
    }

    private static <V> Map<StageType, V> copyOf(Map<StageType, V> source) {
        Map<StageType, V> copy = new EnumMap<>(StageType.class);
        if (source != null) {
            copy.putAll(source);
        }
        return copy;
    }
}
