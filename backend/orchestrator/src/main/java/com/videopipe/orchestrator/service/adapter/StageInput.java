package com.videopipe.orchestrator.service.adapter;

import com.videopipe.common.enums.StageType;
import lombok.Builder;
import lombok.Getter;
import lombok.Singular;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * 어댑터에 전달되는 단계 입력
 */
@Getter
@Builder
public class StageInput {
    private final String pipelineJobId;
    private final String sceneJobId;          // 파이프라인 단위 단계면 null
    private final Integer sceneIndex;
    private final StageType stage;
    private final int attempt;                 // 1부터 시작
    @Singular
    private final Map<String, String> params;
    @Singular
    private final Map<StageType, String> priorAssets;
    @Singular
    private final List<SceneAssets> sceneAssets;  // ASSEMBLY 입력 (sceneIndex 순)
    private final Instant deadline;

    public String param(String key) {
        return params.get(key);
    }

    /**
     * 합성 단계에 넘기는 씬 하나의 결과물
     */
    public record SceneAssets(int sceneIndex, String sceneJobId, Map<StageType, String> assets) {
    }
}
