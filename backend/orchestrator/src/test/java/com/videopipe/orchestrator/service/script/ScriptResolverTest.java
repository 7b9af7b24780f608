package com.videopipe.orchestrator.service.script;

import com.videopipe.common.exception.ApiException;
import com.videopipe.common.exception.ErrorCode;
import com.videopipe.orchestrator.config.PipelineProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * ScriptResolver 단위 테스트
 */
class ScriptResolverTest {

    @TempDir
    Path tempDir;

    private ScriptResolver resolver;

    @BeforeEach
    void setUp() throws IOException {
        Path scripts = Files.createDirectories(tempDir.resolve("scripts"));
        Files.writeString(scripts.resolve("story.md"), "# Story\n---\nOnce upon a time.");
        Files.writeString(tempDir.resolve("secret.txt"), "do not read");

        PipelineProperties properties = new PipelineProperties();
        properties.setScriptDir(scripts.toString());
        resolver = new ScriptResolver(properties);
    }

    @Test
    @DisplayName("기준 디렉터리 아래 파일을 읽는다 (file: 접두어 허용)")
    void resolvesRelativeRef() {
        assertThat(resolver.resolve("story.md")).contains("Once upon a time.");
        assertThat(resolver.resolve("file:story.md")).startsWith("# Story");
    }

    @Test
    @DisplayName("기준 디렉터리 밖을 가리키면 거부")
    void blocksPathTraversal() {
        assertThatThrownBy(() -> resolver.resolve("../secret.txt"))
                .isInstanceOf(ApiException.class)
                .extracting(e -> ((ApiException) e).getErrorCode())
                .isEqualTo(ErrorCode.SCRIPT_PATH_DENIED);
    }

    @Test
    @DisplayName("없는 파일은 SCRIPT_NOT_FOUND")
    void missingFile() {
        assertThatThrownBy(() -> resolver.resolve("missing.md"))
                .isInstanceOf(ApiException.class)
                .extracting(e -> ((ApiException) e).getErrorCode())
                .isEqualTo(ErrorCode.SCRIPT_NOT_FOUND);
    }

    @Test
    @DisplayName("빈 참조는 INVALID_REQUEST")
    void blankRef() {
        assertThatThrownBy(() -> resolver.resolve(" "))
                .isInstanceOf(ApiException.class)
                .extracting(e -> ((ApiException) e).getErrorCode())
                .isEqualTo(ErrorCode.INVALID_REQUEST);
    }
}
