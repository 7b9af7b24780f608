package com.videopipe.orchestrator.service.moderation;

import com.videopipe.common.enums.StageType;
import com.videopipe.orchestrator.config.PipelineProperties;
import com.videopipe.orchestrator.entity.SceneJob;
import com.videopipe.orchestrator.service.error.ModerationRejectedException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 금칙어를 완곡 표현으로 치환하는 기본 대체 입력 생성기
 * - VOICE: 나레이션 치환
 * - VISUAL, VIDEO_CLIP: 시각 프롬프트 치환 + 절제된 스타일 문구 추가
 * - SCRIPT: 씬 본문 치환
 */
@Slf4j
@Component
public class PromptSanitizingFallback implements ModerationFallback {

    private static final Map<String, String> DEFAULT_SUBSTITUTIONS = new LinkedHashMap<>();

    static {
        // 폭력
        DEFAULT_SUBSTITUTIONS.put("blood", "crimson light");
        DEFAULT_SUBSTITUTIONS.put("gore", "shadows");
        DEFAULT_SUBSTITUTIONS.put("weapon", "prop");
        DEFAULT_SUBSTITUTIONS.put("gun", "silhouetted prop");
        DEFAULT_SUBSTITUTIONS.put("knife", "glint of light");
        DEFAULT_SUBSTITUTIONS.put("violence", "tension");
        DEFAULT_SUBSTITUTIONS.put("killing", "ending");
        DEFAULT_SUBSTITUTIONS.put("death", "stillness");
        DEFAULT_SUBSTITUTIONS.put("destruction", "decay");
        DEFAULT_SUBSTITUTIONS.put("conflict", "tension");
        DEFAULT_SUBSTITUTIONS.put("danger", "warning signs");
        // 선정성
        DEFAULT_SUBSTITUTIONS.put("nude", "draped in fabric");
        DEFAULT_SUBSTITUTIONS.put("naked", "draped in fabric");
        DEFAULT_SUBSTITUTIONS.put("sexual", "romantic");
        DEFAULT_SUBSTITUTIONS.put("erotic", "romantic");
        // 혐오, 약물
        DEFAULT_SUBSTITUTIONS.put("nazi", "authoritarian");
        DEFAULT_SUBSTITUTIONS.put("terrorist", "intruder");
        DEFAULT_SUBSTITUTIONS.put("cocaine", "white powder");
        DEFAULT_SUBSTITUTIONS.put("heroin", "unmarked vial");
        DEFAULT_SUBSTITUTIONS.put("drug", "substance");
    }

    private final Map<Pattern, String> substitutions = new LinkedHashMap<>();
    private final String visualSuffix;

    public PromptSanitizingFallback(PipelineProperties properties) {
        Map<String, String> configured = properties.getModeration().getSubstitutions();
        Map<String, String> source = configured.isEmpty() ? DEFAULT_SUBSTITUTIONS : configured;
        source.forEach((term, replacement) -> substitutions.put(
                Pattern.compile("\\b" + Pattern.quote(term) + "\\b", Pattern.CASE_INSENSITIVE), replacement));
        this.visualSuffix = properties.getModeration().getVisualSuffix();
    }

    @Override
    public Map<String, String> rewrite(StageType stage, Map<String, String> inputs, ModerationRejectedException rejection) {
        Map<String, String> rewritten = new LinkedHashMap<>(inputs);
        String key = promptKeyOf(stage);
        if (key == null) {
            return rewritten;
        }

        String original = inputs.get(key);
        if (original == null || original.isBlank()) {
            original = rejection.getOriginalPrompt() == null ? "" : rejection.getOriginalPrompt();
        }

        String sanitized = sanitize(original);
        if (stage == StageType.VISUAL || stage == StageType.VIDEO_CLIP) {
            sanitized = appendSuffix(sanitized);
        }
        rewritten.put(key, sanitized);

        log.info("[Moderation] {} input rewritten after rejection ({}): '{}' → '{}'",
                stage, rejection.getModerationIssueDescription(), abbreviate(original), abbreviate(sanitized));
        return rewritten;
    }

    String sanitize(String text) {
        String result = text;
        for (Map.Entry<Pattern, String> entry : substitutions.entrySet()) {
            Matcher matcher = entry.getKey().matcher(result);
            result = matcher.replaceAll(Matcher.quoteReplacement(entry.getValue()));
        }
        return result;
    }

    private String appendSuffix(String prompt) {
        if (visualSuffix == null || visualSuffix.isBlank() || prompt.contains(visualSuffix)) {
            return prompt;
        }
        return prompt.isBlank() ? visualSuffix : prompt + ", " + visualSuffix;
    }

    private String promptKeyOf(StageType stage) {
        return switch (stage) {
            case SCRIPT -> SceneJob.INPUT_SCENE_TEXT;
            case VOICE -> SceneJob.INPUT_NARRATION;
            case VISUAL, VIDEO_CLIP -> SceneJob.INPUT_VISUAL_PROMPT;
            default -> null;
        };
    }

    private String abbreviate(String text) {
        return text.length() > 80 ? text.substring(0, 80) + "..." : text;
    }
}
