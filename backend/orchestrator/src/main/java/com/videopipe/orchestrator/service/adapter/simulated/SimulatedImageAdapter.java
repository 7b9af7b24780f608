package com.videopipe.orchestrator.service.adapter.simulated;

import com.videopipe.common.enums.StageType;
import com.videopipe.orchestrator.config.PipelineProperties;
import com.videopipe.orchestrator.entity.SceneJob;
import com.videopipe.orchestrator.service.adapter.StageInput;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * 씬 이미지 생성 시뮬레이션
 */
@Component
@ConditionalOnProperty(name = "pipeline.simulated.enabled", havingValue = "true", matchIfMissing = true)
public class SimulatedImageAdapter extends SimulatedStageAdapter {

    public SimulatedImageAdapter(PipelineProperties properties) {
        super(properties);
    }

    @Override
    public StageType stage() {
        return StageType.VISUAL;
    }

    @Override
    protected String promptOf(StageInput input) {
        return input.param(SceneJob.INPUT_VISUAL_PROMPT);
    }

    @Override
    protected void validate(StageInput input) {
        String prompt = input.param(SceneJob.INPUT_VISUAL_PROMPT);
        require(prompt != null && !prompt.isBlank(), stage(), "visual prompt is empty");
    }

    @Override
    protected String extension() {
        return ".png";
    }
}
