package com.videopipe.orchestrator.service.script;

import com.videopipe.common.exception.ApiException;
import com.videopipe.common.exception.ErrorCode;
import com.videopipe.orchestrator.config.PipelineProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * scriptRef → 스크립트 본문.
 * scriptDir 아래의 파일만 허용한다 (경로 탐색 차단).
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ScriptResolver {

    private final PipelineProperties properties;

    public String resolve(String scriptRef) {
        if (scriptRef == null || scriptRef.isBlank()) {
            throw new ApiException(ErrorCode.INVALID_REQUEST, "scriptRef 가 비어 있습니다.");
        }

        Path baseDir = Paths.get(properties.getScriptDir()).toAbsolutePath().normalize();
        String relative = scriptRef.startsWith("file:") ? scriptRef.substring("file:".length()) : scriptRef;
        Path target = baseDir.resolve(relative).normalize();

        if (!target.startsWith(baseDir)) {
            log.warn("[ScriptResolver] Path traversal attempt blocked: {}", scriptRef);
            throw new ApiException(ErrorCode.SCRIPT_PATH_DENIED);
        }
        if (!Files.isRegularFile(target)) {
            throw new ApiException(ErrorCode.SCRIPT_NOT_FOUND, "스크립트를 찾을 수 없습니다: " + scriptRef);
        }

        try {
            return Files.readString(target, StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.error("[ScriptResolver] Failed to read script {}: {}", target, e.getMessage());
            throw new ApiException(ErrorCode.SCRIPT_INVALID, "스크립트를 읽을 수 없습니다: " + scriptRef, e);
        }
    }
}
