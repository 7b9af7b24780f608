package com.videopipe.common.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * 씬 작업 상태 머신.
 * SCRIPT → VOICE → VISUAL → VIDEO_CLIP → READY, FAILED 는 비종료 상태 어디서든 도달 가능.
 */
@Getter
@RequiredArgsConstructor
public enum SceneStage {

    SCRIPT(StageType.SCRIPT),
    VOICE(StageType.VOICE),
    VISUAL(StageType.VISUAL),
    VIDEO_CLIP(StageType.VIDEO_CLIP),
    READY(null),
    FAILED(null);

    /** 이 상태에서 실행할 단계. 종료 상태는 null */
    private final StageType stageType;

    public boolean isTerminal() {
        return this == READY || this == FAILED;
    }

    public SceneStage next() {
        return switch (this) {
            case SCRIPT -> VOICE;
            case VOICE -> VISUAL;
            case VISUAL -> VIDEO_CLIP;
            case VIDEO_CLIP -> READY;
            default -> throw new IllegalStateException("No stage follows " + this);
        };
    }

    public static SceneStage of(StageType stageType) {
        for (SceneStage stage : values()) {
            if (stage.stageType == stageType) {
                return stage;
            }
        }
        throw new IllegalArgumentException("Not a scene-level stage: " + stageType);
    }
}
