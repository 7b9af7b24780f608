package com.videopipe.orchestrator.service.script;

import lombok.Builder;
import lombok.Getter;

import java.util.List;

/**
 * 씬 본문 분석 결과 (나레이션, 시각 프롬프트, 예상 길이)
 */
@Getter
@Builder
public class SceneAnalysis {
    private final String narration;
    private final String visualPrompt;
    private final int durationSeconds;
    private final String emotionalTone;
    private final List<String> speakers;
    private final List<String> directions;
    private final List<String> visualCues;
}
