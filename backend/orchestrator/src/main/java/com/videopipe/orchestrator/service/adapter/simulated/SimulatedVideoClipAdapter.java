package com.videopipe.orchestrator.service.adapter.simulated;

import com.videopipe.common.enums.StageType;
import com.videopipe.orchestrator.config.PipelineProperties;
import com.videopipe.orchestrator.entity.SceneJob;
import com.videopipe.orchestrator.service.adapter.StageInput;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * 이미지 + 프롬프트 기반 씬 영상 생성 시뮬레이션
 */
@Component
@ConditionalOnProperty(name = "pipeline.simulated.enabled", havingValue = "true", matchIfMissing = true)
public class SimulatedVideoClipAdapter extends SimulatedStageAdapter {

    public SimulatedVideoClipAdapter(PipelineProperties properties) {
        super(properties);
    }

    @Override
    public StageType stage() {
        return StageType.VIDEO_CLIP;
    }

    @Override
    protected String promptOf(StageInput input) {
        return input.param(SceneJob.INPUT_VISUAL_PROMPT);
    }

    @Override
    protected void validate(StageInput input) {
        require(input.getPriorAssets().containsKey(StageType.VISUAL), stage(), "source image is missing");
    }

    @Override
    protected String extension() {
        return ".mp4";
    }
}
