package com.videopipe.orchestrator.service.script;

import java.util.List;
import java.util.Map;

/**
 * 씬 단위로 분해된 스크립트
 *
 * @param title    # 제목 (없으면 빈 문자열)
 * @param metadata **Key**: value 형식의 메타데이터 (키는 소문자)
 * @param scenes   구분선 기준으로 나눈 씬 (sceneIndex 0부터)
 */
public record ParsedScript(String title, Map<String, String> metadata, List<Scene> scenes) {

    public ParsedScript {
        metadata = Map.copyOf(metadata);
        scenes = List.copyOf(scenes);
    }

    public record Scene(int sceneIndex, int startLine, String text) {
    }
}
