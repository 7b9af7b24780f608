package com.videopipe.orchestrator.service.adapter.simulated;

import com.videopipe.common.enums.StageType;
import com.videopipe.orchestrator.config.PipelineProperties;
import com.videopipe.orchestrator.service.adapter.PollResult;
import com.videopipe.orchestrator.service.adapter.StageAdapter;
import com.videopipe.orchestrator.service.adapter.StageInput;
import com.videopipe.orchestrator.service.adapter.TaskHandle;
import com.videopipe.orchestrator.service.error.ModerationRejectedException.ModerationCategory;
import com.videopipe.orchestrator.service.error.TerminalStageException;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ThreadLocalRandom;
import java.util.regex.Pattern;

/**
 * 외부 벤더 없이 파이프라인을 돌려볼 수 있는 시뮬레이션 어댑터 공통 로직.
 * - 설정된 지연 후 완료
 * - 금칙어가 포함된 프롬프트는 안전 필터 거부
 * - transientFailureRate 확률로 429/503 응답
 */
@Slf4j
public abstract class SimulatedStageAdapter implements StageAdapter {

    protected final PipelineProperties.Simulated settings;

    private final Map<String, SimulatedTask> tasks = new ConcurrentHashMap<>();

    protected SimulatedStageAdapter(PipelineProperties properties) {
        this.settings = properties.getSimulated();
    }

    /** 모더레이션 검사 대상 프롬프트 (없으면 null) */
    protected abstract String promptOf(StageInput input);

    protected abstract String extension();

    /** 입력 검증. 문제가 있으면 TerminalStageException */
    protected void validate(StageInput input) {
    }

    @Override
    public TaskHandle submit(StageInput input) {
        validate(input);

        String taskId = stage().name().toLowerCase(Locale.ROOT) + "-" + UUID.randomUUID();
        long readyAt = System.currentTimeMillis() + settings.getLatency().toMillis();
        tasks.put(taskId, new SimulatedTask(System.currentTimeMillis(), readyAt, respond(input)));

        log.debug("[Simulated:{}] Submitted task {} (scene={}, attempt={})",
                stage(), taskId, input.getSceneIndex(), input.getAttempt());
        return new TaskHandle(taskId, stage(), Instant.now());
    }

    @Override
    public PollResult poll(TaskHandle handle) {
        SimulatedTask task = tasks.get(handle.taskId());
        if (task == null) {
            return PollResult.failed(new TerminalStageException("Unknown task " + handle.taskId(), 404));
        }
        long now = System.currentTimeMillis();
        if (now < task.readyAt()) {
            long total = Math.max(1, task.readyAt() - task.submittedAt());
            return PollResult.pending((int) ((now - task.submittedAt()) * 100 / total));
        }
        tasks.remove(handle.taskId());
        return task.response().toPollResult();
    }

    @Override
    public void cancel(TaskHandle handle) {
        if (tasks.remove(handle.taskId()) != null) {
            log.info("[Simulated:{}] Task {} cancelled", stage(), handle.taskId());
        }
    }

    private VendorResponse respond(StageInput input) {
        String prompt = promptOf(input);
        String blockedTerm = findBlockedTerm(prompt);
        if (blockedTerm != null) {
            return new VendorResponse.ContentFiltered("SAFETY", prompt, List.of(
                    new ModerationCategory(categoryOf(blockedTerm), "HIGH", true)));
        }

        double rate = settings.getTransientFailureRate();
        if (rate > 0 && ThreadLocalRandom.current().nextDouble() < rate) {
            return ThreadLocalRandom.current().nextBoolean()
                    ? new VendorResponse.Throttled(5)
                    : new VendorResponse.ServiceUnavailable(503);
        }

        return new VendorResponse.Completed(assetUri(input), settings.getCostPerCall(), Map.of());
    }

    private String findBlockedTerm(String prompt) {
        if (prompt == null || prompt.isBlank()) {
            return null;
        }
        for (String term : settings.getBlockedTerms()) {
            Pattern pattern = Pattern.compile("\\b" + Pattern.quote(term) + "\\b", Pattern.CASE_INSENSITIVE);
            if (pattern.matcher(prompt).find()) {
                return term;
            }
        }
        return null;
    }

    private String categoryOf(String term) {
        return switch (term.toLowerCase(Locale.ROOT)) {
            case "nude", "naked", "sexual", "erotic" -> "HARM_CATEGORY_SEXUALLY_EXPLICIT";
            case "nazi", "terrorist" -> "HARM_CATEGORY_HATE_SPEECH";
            case "cocaine", "heroin" -> "HARM_CATEGORY_DANGEROUS_CONTENT";
            default -> "HARM_CATEGORY_VIOLENCE";
        };
    }

    protected String assetUri(StageInput input) {
        String owner = input.getSceneJobId() != null ? "scene-" + input.getSceneIndex() : "job";
        return settings.getAssetBaseUri() + "/" + input.getPipelineJobId() + "/" + owner + "/"
                + stage().name().toLowerCase(Locale.ROOT) + "-a" + input.getAttempt() + extension();
    }

    private record SimulatedTask(long submittedAt, long readyAt, VendorResponse response) {
    }

    protected static void require(boolean condition, StageType stage, String message) {
        if (!condition) {
            throw new TerminalStageException("[" + stage + "] " + message, 400);
        }
    }
}
