package com.videopipe.orchestrator.service.adapter;

import com.videopipe.common.enums.StageType;
import com.videopipe.orchestrator.entity.SceneJob;
import com.videopipe.orchestrator.service.error.TerminalStageException;
import com.videopipe.orchestrator.service.script.SceneAnalysis;
import com.videopipe.orchestrator.service.script.ScriptParser;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * SCRIPT 단계: 씬 본문에서 나레이션, 시각 프롬프트, 예상 길이를 뽑아 다음 단계 입력으로 넘긴다.
 * 로컬 계산이라 submit 시점에 결과가 확정된다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ScriptAnalysisAdapter implements StageAdapter {

    private final ScriptParser scriptParser;

    private final Map<String, PollResult> results = new ConcurrentHashMap<>();

    @Override
    public StageType stage() {
        return StageType.SCRIPT;
    }

    @Override
    public TaskHandle submit(StageInput input) {
        String sceneText = input.param(SceneJob.INPUT_SCENE_TEXT);
        if (sceneText == null || sceneText.isBlank()) {
            throw new TerminalStageException("Scene " + input.getSceneIndex() + " has no text", 400);
        }

        SceneAnalysis analysis = scriptParser.analyze(sceneText);
        if (analysis.getNarration().isBlank()) {
            throw new TerminalStageException("Scene " + input.getSceneIndex() + " has no narration or dialogue", 400);
        }

        Map<String, String> outputs = new LinkedHashMap<>();
        outputs.put(SceneJob.INPUT_NARRATION, analysis.getNarration());
        outputs.put(SceneJob.INPUT_VISUAL_PROMPT, analysis.getVisualPrompt());
        outputs.put(SceneJob.INPUT_DURATION, String.valueOf(analysis.getDurationSeconds()));

        String taskId = "script-" + UUID.randomUUID();
        String assetRef = "script://" + input.getPipelineJobId() + "/scene-" + input.getSceneIndex() + "/analysis";
        results.put(taskId, PollResult.succeeded(assetRef, BigDecimal.ZERO, outputs));

        log.debug("[ScriptAnalysis] scene={} duration={}s tone={} cues={}",
                input.getSceneIndex(), analysis.getDurationSeconds(), analysis.getEmotionalTone(),
                analysis.getVisualCues().size());
        return new TaskHandle(taskId, stage(), Instant.now());
    }

    @Override
    public PollResult poll(TaskHandle handle) {
        PollResult result = results.remove(handle.taskId());
        return result != null
                ? result
                : PollResult.failed(new TerminalStageException("Unknown task " + handle.taskId(), 404));
    }

    @Override
    public void cancel(TaskHandle handle) {
        results.remove(handle.taskId());
    }
}
