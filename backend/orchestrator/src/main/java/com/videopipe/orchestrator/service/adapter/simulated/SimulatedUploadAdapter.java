package com.videopipe.orchestrator.service.adapter.simulated;

import com.videopipe.common.enums.StageType;
import com.videopipe.orchestrator.config.PipelineProperties;
import com.videopipe.orchestrator.service.adapter.StageInput;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * 최종 영상 업로드 시뮬레이션
 */
@Component
@ConditionalOnProperty(name = "pipeline.simulated.enabled", havingValue = "true", matchIfMissing = true)
public class SimulatedUploadAdapter extends SimulatedStageAdapter {

    public SimulatedUploadAdapter(PipelineProperties properties) {
        super(properties);
    }

    @Override
    public StageType stage() {
        return StageType.UPLOAD;
    }

    @Override
    protected String promptOf(StageInput input) {
        return null;
    }

    @Override
    protected void validate(StageInput input) {
        require(input.getPriorAssets().containsKey(StageType.ASSEMBLY), stage(), "assembled video is missing");
    }

    @Override
    protected String extension() {
        return ".mp4";
    }
}
