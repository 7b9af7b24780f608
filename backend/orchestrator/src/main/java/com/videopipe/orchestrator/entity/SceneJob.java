package com.videopipe.orchestrator.entity;

import com.videopipe.common.enums.FailureKind;
import com.videopipe.common.enums.SceneStage;
import com.videopipe.common.enums.StageType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * 씬 작업 엔티티
 * 한 씬이 SCRIPT → VOICE → VISUAL → VIDEO_CLIP 단계를 거쳐 READY 가 되기까지의 상태
 */
@Getter
@Setter
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class SceneJob {

    // 단계 입력 키
    public static final String INPUT_TITLE = "title";
    public static final String INPUT_SCENE_TEXT = "sceneText";
    public static final String INPUT_NARRATION = "narration";
    public static final String INPUT_VISUAL_PROMPT = "visualPrompt";
    public static final String INPUT_DURATION = "durationSeconds";

    private String sceneJobId;
    private String pipelineJobId;
    private Integer sceneIndex;
    private SceneStage currentStage;
    private StageType inFlightStage;       // 호출 진행 중인 단계 (없으면 null)
    private StageType failedStage;         // FAILED 로 끝난 단계
    @Builder.Default
    private Map<StageType, Integer> attempts = new EnumMap<>(StageType.class);
    @Builder.Default
    private Set<StageType> fallbackUsed = EnumSet.noneOf(StageType.class);  // 모더레이션 대체 입력을 쓴 단계
    @Builder.Default
    private Map<String, String> inputs = new LinkedHashMap<>();
    @Builder.Default
    private Map<StageType, String> assets = new EnumMap<>(StageType.class);
    private String lastError;
    private FailureKind lastErrorKind;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;

    public int attemptsOf(StageType stage) {
        return attempts.getOrDefault(stage, 0);
    }

    public boolean isReady() {
        return currentStage == SceneStage.READY;
    }

    public boolean isFailed() {
        return currentStage == SceneStage.FAILED;
    }

    public boolean isTerminal() {
        return currentStage != null && currentStage.isTerminal();
    }

    public String input(String key) {
        return inputs.get(key);
    }

    /**
     * 저장소 스냅샷용 깊은 복사
     */
    public SceneJob copy() {
        Map<StageType, Integer> attemptsCopy = new EnumMap<>(StageType.class);
        attemptsCopy.putAll(attempts);
        Set<StageType> fallbackCopy = EnumSet.noneOf(StageType.class);
        fallbackCopy.addAll(fallbackUsed);
        Map<StageType, String> assetsCopy = new EnumMap<>(StageType.class);
        assetsCopy.putAll(assets);
        return toBuilder()
                .attempts(attemptsCopy)
                .fallbackUsed(fallbackCopy)
                .inputs(new LinkedHashMap<>(inputs))
                .assets(assetsCopy)
                .build();
    }
}
