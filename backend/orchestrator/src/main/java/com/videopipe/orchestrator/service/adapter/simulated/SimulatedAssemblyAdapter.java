package com.videopipe.orchestrator.service.adapter.simulated;

import com.videopipe.common.enums.StageType;
import com.videopipe.orchestrator.config.PipelineProperties;
import com.videopipe.orchestrator.service.adapter.StageInput;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * 씬 영상 + 나레이션 합성 시뮬레이션
 */
@Component
@ConditionalOnProperty(name = "pipeline.simulated.enabled", havingValue = "true", matchIfMissing = true)
public class SimulatedAssemblyAdapter extends SimulatedStageAdapter {

    public SimulatedAssemblyAdapter(PipelineProperties properties) {
        super(properties);
    }

    @Override
    public StageType stage() {
        return StageType.ASSEMBLY;
    }

    @Override
    protected String promptOf(StageInput input) {
        return null;
    }

    @Override
    protected void validate(StageInput input) {
        require(!input.getSceneAssets().isEmpty(), stage(), "no scene clips to assemble");
        for (StageInput.SceneAssets scene : input.getSceneAssets()) {
            require(scene.assets().containsKey(StageType.VIDEO_CLIP), stage(),
                    "scene " + scene.sceneIndex() + " has no video clip");
        }
    }

    @Override
    protected String extension() {
        return ".mp4";
    }
}
