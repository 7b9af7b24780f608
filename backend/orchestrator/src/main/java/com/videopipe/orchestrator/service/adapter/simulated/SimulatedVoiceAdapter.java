package com.videopipe.orchestrator.service.adapter.simulated;

import com.videopipe.common.enums.StageType;
import com.videopipe.orchestrator.config.PipelineProperties;
import com.videopipe.orchestrator.entity.SceneJob;
import com.videopipe.orchestrator.service.adapter.StageInput;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * 나레이션 TTS 시뮬레이션
 */
@Component
@ConditionalOnProperty(name = "pipeline.simulated.enabled", havingValue = "true", matchIfMissing = true)
public class SimulatedVoiceAdapter extends SimulatedStageAdapter {

    public SimulatedVoiceAdapter(PipelineProperties properties) {
        super(properties);
    }

    @Override
    public StageType stage() {
        return StageType.VOICE;
    }

    @Override
    protected String promptOf(StageInput input) {
        return input.param(SceneJob.INPUT_NARRATION);
    }

    @Override
    protected void validate(StageInput input) {
        String narration = input.param(SceneJob.INPUT_NARRATION);
        require(narration != null && !narration.isBlank(), stage(), "narration is empty");
    }

    @Override
    protected String extension() {
        return ".mp3";
    }
}
