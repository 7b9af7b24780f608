package com.videopipe.orchestrator.service.scheduler;

import com.videopipe.common.enums.FailureKind;
import com.videopipe.common.enums.PipelineStatus;
import com.videopipe.common.enums.SceneStage;
import com.videopipe.common.enums.StageOutcome;
import com.videopipe.common.enums.StageType;
import com.videopipe.common.exception.ApiException;
import com.videopipe.common.exception.ErrorCode;
import com.videopipe.orchestrator.config.ExecutorConfig;
import com.videopipe.orchestrator.config.PipelineProperties;
import com.videopipe.orchestrator.entity.SceneJob;
import com.videopipe.orchestrator.entity.StageCallRecord;
import com.videopipe.orchestrator.service.adapter.PollResult;
import com.videopipe.orchestrator.service.adapter.StageAdapterRegistry;
import com.videopipe.orchestrator.service.adapter.StageInput;
import com.videopipe.orchestrator.service.error.ModerationRejectedException;
import com.videopipe.orchestrator.service.error.RetryableStageException;
import com.videopipe.orchestrator.service.error.TerminalStageException;
import com.videopipe.orchestrator.service.moderation.PromptSanitizingFallback;
import com.videopipe.orchestrator.service.progress.ProgressBroadcaster;
import com.videopipe.orchestrator.service.progress.ProgressEvent;
import com.videopipe.orchestrator.service.progress.ProgressEventType;
import com.videopipe.orchestrator.service.progress.ProgressSubscription;
import com.videopipe.orchestrator.service.retry.ExponentialBackoffRetryPolicy;
import com.videopipe.orchestrator.service.retry.StagePacingService;
import com.videopipe.orchestrator.service.store.InMemoryJobStore;
import com.videopipe.orchestrator.service.store.JobSnapshot;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.BooleanSupplier;
import java.util.function.Predicate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.fail;

/**
 * PipelineScheduler 통합 테스트 (메모리 저장소 + 스크립트 어댑터)
 */
class PipelineSchedulerTest {

    private static final long AWAIT_TIMEOUT_MS = 10_000;

    private PipelineProperties properties;
    private InMemoryJobStore jobStore;
    private ProgressBroadcaster broadcaster;
    private ExecutorService workers;
    private ExecutorService cancellers;
    private ScheduledExecutorService timer;
    private Map<StageType, ScriptedStageAdapter> adapters;
    private final List<PipelineScheduler> schedulers = new ArrayList<>();

    @BeforeEach
    void setUp() {
        properties = new PipelineProperties();
        properties.getRetry().setBaseDelay(Duration.ofMillis(10));
        properties.getRetry().setMaxDelay(Duration.ofMillis(50));
        properties.getRetry().setJitterRatio(0.0);
        properties.getTimeout().setDefaultTimeout(Duration.ofSeconds(5));
        properties.setPollInterval(Duration.ofMillis(10));

        jobStore = new InMemoryJobStore();
        broadcaster = new ProgressBroadcaster(properties);
        workers = Executors.newFixedThreadPool(16, ExecutorConfig.namedThreadFactory("test-worker"));
        cancellers = Executors.newCachedThreadPool(ExecutorConfig.namedThreadFactory("test-cancel"));
        timer = Executors.newScheduledThreadPool(2, ExecutorConfig.namedThreadFactory("test-timer"));
        adapters = newAdapters();
    }

    @AfterEach
    void tearDown() {
        adapters.values().forEach(ScriptedStageAdapter::release);
        schedulers.forEach(PipelineScheduler::stop);
        workers.shutdownNow();
        cancellers.shutdownNow();
        timer.shutdownNow();
    }

    // ========== 정상/재시도 ==========

    @Test
    @DisplayName("씬 3개 중 2번째 씬 VISUAL 이 두 번 실패 후 성공하면 완료되고 시도 횟수는 3")
    void completesAfterTransientVisualFailures() {
        // given
        adapters.get(StageType.VISUAL).behave(input -> {
            if (input.getSceneIndex() == 1 && input.getAttempt() <= 2) {
                throw new RetryableStageException("vendor returned 503", 503, false, null);
            }
            return adapters.get(StageType.VISUAL).success(input);
        });
        PipelineScheduler scheduler = newScheduler();

        // when
        String jobId = scheduler.submit(submission(3));
        JobSnapshot snapshot = awaitStatus(jobId, PipelineStatus.COMPLETED);

        // then
        assertThat(sceneAt(snapshot, 1).attemptsOf(StageType.VISUAL)).isEqualTo(3);
        assertThat(sceneAt(snapshot, 0).attemptsOf(StageType.VISUAL)).isEqualTo(1);
        assertThat(sceneAt(snapshot, 2).attemptsOf(StageType.VISUAL)).isEqualTo(1);
        assertThat(snapshot.sceneJobs()).allMatch(SceneJob::isReady);
        assertThat(snapshot.pipelineJob().getFinalAssetRef()).contains("upload");

        List<StageCallRecord> audit = jobStore.findAuditRecords(jobId);
        assertThat(audit).filteredOn(record -> record.getOutcome() == StageOutcome.RETRYABLE_FAILURE).hasSize(2);
        assertThat(audit).filteredOn(record -> record.getStage() == StageType.UPLOAD).hasSize(1);
    }

    @Test
    @DisplayName("재시도 가능한 오류가 최대 시도 횟수를 넘으면 씬은 INFRASTRUCTURE 로 실패")
    void failsSceneWhenRetriesExhausted() {
        // given
        adapters.get(StageType.VOICE).behave(input -> {
            throw new RetryableStageException("vendor returned 503", 503, false, null);
        });
        PipelineScheduler scheduler = newScheduler();

        // when
        String jobId = scheduler.submit(submission(1));
        JobSnapshot snapshot = awaitStatus(jobId, PipelineStatus.FAILED);

        // then
        SceneJob scene = sceneAt(snapshot, 0);
        assertThat(scene.getCurrentStage()).isEqualTo(SceneStage.FAILED);
        assertThat(scene.getFailedStage()).isEqualTo(StageType.VOICE);
        assertThat(scene.attemptsOf(StageType.VOICE)).isEqualTo(3);
        assertThat(scene.getLastErrorKind()).isEqualTo(FailureKind.INFRASTRUCTURE);
        assertThat(scene.getLastError()).startsWith(FailureKind.INFRASTRUCTURE.getUserGuidance());
        assertThat(snapshot.pipelineJob().getLastErrorKind()).isEqualTo(FailureKind.SCENE_FAILED);
        assertThat(adapters.get(StageType.VOICE).submitted()).hasSize(3);
    }

    @Test
    @DisplayName("종료 오류는 재시도 없이 한 번에 씬을 실패시킨다")
    void failsSceneImmediatelyOnTerminalError() {
        // given
        adapters.get(StageType.VOICE).behave(input -> {
            throw new TerminalStageException("voice id not found", 400);
        });
        PipelineScheduler scheduler = newScheduler();

        // when
        String jobId = scheduler.submit(submission(1));
        JobSnapshot snapshot = awaitStatus(jobId, PipelineStatus.FAILED);

        // then
        SceneJob scene = sceneAt(snapshot, 0);
        assertThat(scene.attemptsOf(StageType.VOICE)).isEqualTo(1);
        assertThat(scene.getLastErrorKind()).isEqualTo(FailureKind.TERMINAL);
        assertThat(adapters.get(StageType.VISUAL).submitted()).isEmpty();
    }

    @Test
    @DisplayName("단계 호출이 마감 시간을 넘기면 재시도 가능한 실패로 처리")
    void timesOutHangingCalls() {
        // given
        properties.getTimeout().getPerStage().put(StageType.VOICE, Duration.ofMillis(100));
        adapters.get(StageType.VOICE).hold();
        PipelineScheduler scheduler = newScheduler();

        // when
        String jobId = scheduler.submit(submission(1));
        JobSnapshot snapshot = awaitStatus(jobId, PipelineStatus.FAILED);

        // then
        SceneJob scene = sceneAt(snapshot, 0);
        assertThat(scene.attemptsOf(StageType.VOICE)).isEqualTo(3);
        assertThat(scene.getLastErrorKind()).isEqualTo(FailureKind.INFRASTRUCTURE);
        assertThat(jobStore.findAuditRecords(jobId))
                .filteredOn(record -> record.getStage() == StageType.VOICE)
                .allMatch(record -> record.getErrorMessage() != null && record.getErrorMessage().contains("deadline"));
    }

    @Test
    @DisplayName("마감 초과 후 벤더 취소가 오래 걸려도 다른 작업의 폴링은 지연되지 않는다")
    void slowVendorCancelDoesNotStallOtherJobs() {
        // given: 작업 A 의 VISUAL 두 건이 마감을 넘기고, 벤더 취소는 4초간 블로킹
        properties.getConcurrency().put(StageType.VISUAL, 2);
        properties.getTimeout().getPerStage().put(StageType.VISUAL, Duration.ofMillis(100));
        ScriptedStageAdapter visual = adapters.get(StageType.VISUAL);
        visual.hold();
        visual.cancelDelay(Duration.ofSeconds(4));
        PipelineScheduler scheduler = newScheduler();
        scheduler.submit(submission(2));
        await(() -> visual.cancelledCount() >= 2);

        // when: 작업 B 의 SCRIPT, VOICE 는 각각 두 번 PENDING 후 완료 (10ms 간격 폴링)
        adapters.get(StageType.SCRIPT).pendingPolls(2);
        adapters.get(StageType.VOICE).pendingPolls(2);
        long startedAt = System.currentTimeMillis();
        String jobB = scheduler.submit(submission(1));
        await(() -> countStage(jobB, SceneStage.VISUAL) == 1);
        long elapsed = System.currentTimeMillis() - startedAt;

        // then
        assertThat(elapsed).isLessThan(1_500);
        assertThat(sceneAt(scheduler.getStatus(jobB), 0).attemptsOf(StageType.VOICE)).isEqualTo(1);
    }

    // ========== 모더레이션 ==========

    @Test
    @DisplayName("VOICE 모더레이션 거부 후 대체 입력도 거부되면 MODERATION_REJECTED 로 실패 (일반 1회 + 대체 1회)")
    void failsAfterModerationFallbackRejected() {
        // given
        adapters.get(StageType.VOICE).behave(input -> {
            throw new ModerationRejectedException("SAFETY", input.param(SceneJob.INPUT_NARRATION), List.of());
        });
        PipelineScheduler scheduler = newScheduler();

        // when
        String jobId = scheduler.submit(PipelineSubmission.builder()
                .scriptRef("moderation.md")
                .sceneText("The knight raised his gun as blood covered the floor.")
                .build());
        JobSnapshot snapshot = awaitStatus(jobId, PipelineStatus.FAILED);

        // then
        SceneJob scene = sceneAt(snapshot, 0);
        assertThat(scene.attemptsOf(StageType.VOICE)).isEqualTo(2);
        assertThat(scene.getFallbackUsed()).containsExactly(StageType.VOICE);
        assertThat(scene.getLastErrorKind()).isEqualTo(FailureKind.MODERATION_REJECTED);
        assertThat(scene.getLastError()).startsWith(FailureKind.MODERATION_REJECTED.getUserGuidance());

        List<String> narrations = adapters.get(StageType.VOICE).submitted().stream()
                .map(input -> input.param(SceneJob.INPUT_NARRATION))
                .toList();
        assertThat(narrations).hasSize(2);
        assertThat(narrations.get(0)).contains("blood");
        assertThat(narrations.get(1)).doesNotContain("blood").contains("crimson light");
    }

    @Test
    @DisplayName("모더레이션 거부 후 대체 입력이 통과하면 씬은 계속 진행")
    void continuesWhenFallbackAccepted() {
        // given
        adapters.get(StageType.VISUAL).behave(input -> {
            if (input.param(SceneJob.INPUT_VISUAL_PROMPT).contains("gun")) {
                throw new ModerationRejectedException("SAFETY", input.param(SceneJob.INPUT_VISUAL_PROMPT), List.of());
            }
            return adapters.get(StageType.VISUAL).success(input);
        });
        PipelineScheduler scheduler = newScheduler();

        // when
        String jobId = scheduler.submit(PipelineSubmission.builder()
                .scriptRef("western.md")
                .sceneText("A cowboy holds a gun at sunset.")
                .build());
        JobSnapshot snapshot = awaitStatus(jobId, PipelineStatus.COMPLETED);

        // then
        SceneJob scene = sceneAt(snapshot, 0);
        assertThat(scene.attemptsOf(StageType.VISUAL)).isEqualTo(2);
        assertThat(scene.input(SceneJob.INPUT_VISUAL_PROMPT))
                .contains("silhouetted prop")
                .endsWith(properties.getModeration().getVisualSuffix());
    }

    @Test
    @DisplayName("마지막 일반 시도에서 모더레이션 거부돼도 대체 입력으로 한 번 더 시도한다")
    void usesFallbackWhenRejectedOnLastGenericAttempt() {
        // given: VISUAL 이 두 번 일시 오류, 세 번째(마지막 일반 시도)에서 모더레이션 거부
        ScriptedStageAdapter visual = adapters.get(StageType.VISUAL);
        visual.behave(input -> {
            if (input.getAttempt() <= 2) {
                throw new RetryableStageException("vendor returned 503", 503, false, null);
            }
            if (input.param(SceneJob.INPUT_VISUAL_PROMPT).contains("gun")) {
                throw new ModerationRejectedException("SAFETY", input.param(SceneJob.INPUT_VISUAL_PROMPT), List.of());
            }
            return visual.success(input);
        });
        PipelineScheduler scheduler = newScheduler();

        // when
        String jobId = scheduler.submit(PipelineSubmission.builder()
                .scriptRef("western.md")
                .sceneText("A cowboy holds a gun at sunset.")
                .build());
        JobSnapshot snapshot = awaitStatus(jobId, PipelineStatus.COMPLETED);

        // then
        SceneJob scene = sceneAt(snapshot, 0);
        assertThat(scene.attemptsOf(StageType.VISUAL)).isEqualTo(4);
        assertThat(scene.getFallbackUsed()).containsExactly(StageType.VISUAL);
        assertThat(visual.submitted()).hasSize(4);
        assertThat(visual.submitted().get(3).param(SceneJob.INPUT_VISUAL_PROMPT)).contains("silhouetted prop");
        assertThat(jobStore.findAuditRecords(jobId))
                .filteredOn(record -> record.getStage() == StageType.VISUAL)
                .extracting(StageCallRecord::getOutcome)
                .containsExactly(StageOutcome.RETRYABLE_FAILURE, StageOutcome.RETRYABLE_FAILURE,
                        StageOutcome.MODERATION_REJECTED, StageOutcome.SUCCESS);
    }

    // ========== 취소 ==========

    @Test
    @DisplayName("5개 씬 중 2개가 VISUAL 진행 중일 때 취소하면 추가 디스패치 없이 CANCELLED, 결과물은 유지")
    void cancelStopsDispatchAndKeepsAssets() {
        // given
        properties.getConcurrency().put(StageType.VISUAL, 2);
        ScriptedStageAdapter visual = adapters.get(StageType.VISUAL);
        visual.hold();
        PipelineScheduler scheduler = newScheduler();
        String jobId = scheduler.submit(submission(5));
        await(() -> visual.inFlight() == 2 && countStage(jobId, SceneStage.VISUAL) == 5);

        // when
        JobSnapshot cancelled = scheduler.cancel(jobId);

        // then
        assertThat(cancelled.pipelineJob().getStatus()).isEqualTo(PipelineStatus.CANCELLED);
        await(() -> visual.cancelledCount() == 2);
        visual.release();
        sleep(200);

        assertThat(visual.submitted()).hasSize(2);
        assertThat(adapters.get(StageType.VIDEO_CLIP).submitted()).isEmpty();

        JobSnapshot snapshot = scheduler.getStatus(jobId);
        assertThat(snapshot.pipelineJob().getStatus()).isEqualTo(PipelineStatus.CANCELLED);
        assertThat(snapshot.sceneJobs()).allMatch(scene -> scene.getAssets().containsKey(StageType.VOICE));
        assertThat(snapshot.sceneJobs()).allMatch(scene -> scene.getInFlightStage() == null);
        assertThat(snapshot.sceneJobs()).allMatch(scene -> scene.attemptsOf(StageType.VISUAL) == 0);
        assertThat(jobStore.findAuditRecords(jobId))
                .filteredOn(record -> record.getOutcome() == StageOutcome.ABANDONED)
                .hasSize(2);
    }

    @Test
    @DisplayName("완료된 작업은 취소할 수 없고, 취소된 작업을 다시 취소하면 그대로 반환")
    void cancelRespectsFinalStates() {
        // given
        PipelineScheduler scheduler = newScheduler();
        String completedJob = scheduler.submit(submission(1));
        awaitStatus(completedJob, PipelineStatus.COMPLETED);

        adapters.get(StageType.SCRIPT).hold();
        String runningJob = scheduler.submit(submission(1));
        scheduler.cancel(runningJob);

        // when & then
        assertThatThrownBy(() -> scheduler.cancel(completedJob))
                .isInstanceOf(ApiException.class)
                .extracting(e -> ((ApiException) e).getErrorCode())
                .isEqualTo(ErrorCode.PIPELINE_ALREADY_FINISHED);
        assertThat(scheduler.cancel(runningJob).pipelineJob().getStatus()).isEqualTo(PipelineStatus.CANCELLED);
    }

    // ========== 씬/파이프라인 재시도 ==========

    @Test
    @DisplayName("READY 씬 재시도는 아무것도 하지 않는다")
    void retryOfReadySceneIsNoOp() {
        // given: 1번 씬만 실패해 파이프라인은 FAILED, 0번 씬은 READY
        adapters.get(StageType.VOICE).behave(input -> {
            if (input.getSceneIndex() == 1) {
                throw new TerminalStageException("narration too long", 400);
            }
            return adapters.get(StageType.VOICE).success(input);
        });
        PipelineScheduler scheduler = newScheduler();
        String jobId = scheduler.submit(submission(2));
        JobSnapshot failed = awaitStatus(jobId, PipelineStatus.FAILED);
        String readyScene = sceneAt(failed, 0).getSceneJobId();

        // when
        JobSnapshot result = scheduler.retryFailedScene(readyScene, Map.of(SceneJob.INPUT_NARRATION, "ignored"));

        // then
        assertThat(result.pipelineJob().getStatus()).isEqualTo(PipelineStatus.FAILED);
        assertThat(sceneAt(result, 0).isReady()).isTrue();
        assertThat(sceneAt(result, 0).input(SceneJob.INPUT_NARRATION)).isNotEqualTo("ignored");
        assertThat(sceneAt(result, 0).attemptsOf(StageType.VISUAL)).isEqualTo(1);
        assertThat(adapters.get(StageType.VISUAL).submittedFor(0)).hasSize(1);
    }

    @Test
    @DisplayName("존재하지 않는 씬 재시도는 SCENE_JOB_NOT_FOUND")
    void retryOfUnknownSceneFails() {
        PipelineScheduler scheduler = newScheduler();

        assertThatThrownBy(() -> scheduler.retryFailedScene("missing-scene", null))
                .isInstanceOf(ApiException.class)
                .extracting(e -> ((ApiException) e).getErrorCode())
                .isEqualTo(ErrorCode.SCENE_JOB_NOT_FOUND);
    }

    @Test
    @DisplayName("실패한 씬을 입력 교체와 함께 재시도하면 실패 단계부터 새 시도 횟수로 진행해 완료")
    void retryFailedSceneReopensPipeline() {
        // given
        AtomicBoolean broken = new AtomicBoolean(true);
        adapters.get(StageType.VISUAL).behave(input -> {
            if (input.getSceneIndex() == 0 && broken.get()) {
                throw new TerminalStageException("unsupported aspect ratio", 400);
            }
            return adapters.get(StageType.VISUAL).success(input);
        });
        PipelineScheduler scheduler = newScheduler();
        String jobId = scheduler.submit(submission(2));
        JobSnapshot failed = awaitStatus(jobId, PipelineStatus.FAILED);
        assertThat(failed.pipelineJob().getLastErrorKind()).isEqualTo(FailureKind.SCENE_FAILED);
        assertThat(adapters.get(StageType.ASSEMBLY).submitted()).isEmpty();

        // when
        broken.set(false);
        JobSnapshot reopened = scheduler.retryFailedScene(sceneAt(failed, 0).getSceneJobId(),
                Map.of(SceneJob.INPUT_VISUAL_PROMPT, "a calm harbor at dawn"));

        // then
        assertThat(reopened.pipelineJob().getStatus()).isEqualTo(PipelineStatus.RUNNING);
        assertThat(sceneAt(reopened, 0).getCurrentStage()).isEqualTo(SceneStage.VISUAL);

        JobSnapshot completed = awaitStatus(jobId, PipelineStatus.COMPLETED);
        assertThat(sceneAt(completed, 0).attemptsOf(StageType.VISUAL)).isEqualTo(1);
        assertThat(adapters.get(StageType.VISUAL).submittedFor(0))
                .last()
                .satisfies(input -> assertThat(input.param(SceneJob.INPUT_VISUAL_PROMPT)).isEqualTo("a calm harbor at dawn"));
    }

    @Test
    @DisplayName("실패 씬 제외 합성이 허용되면 READY 씬만으로 합성해 완료")
    void assemblesReadyScenesWhenPartialAllowed() {
        // given
        adapters.get(StageType.VOICE).behave(input -> {
            if (input.getSceneIndex() == 1) {
                throw new TerminalStageException("narration too long", 400);
            }
            return adapters.get(StageType.VOICE).success(input);
        });
        PipelineScheduler scheduler = newScheduler();

        // when
        String jobId = scheduler.submit(PipelineSubmission.builder()
                .scriptRef("partial.md")
                .sceneText("first")
                .sceneText("second")
                .sceneText("third")
                .allowPartialAssembly(true)
                .build());
        JobSnapshot snapshot = awaitStatus(jobId, PipelineStatus.COMPLETED);

        // then
        assertThat(sceneAt(snapshot, 1).isFailed()).isTrue();
        assertThat(adapters.get(StageType.ASSEMBLY).submitted()).hasSize(1);
        assertThat(adapters.get(StageType.ASSEMBLY).submitted().get(0).getSceneAssets())
                .extracting(StageInput.SceneAssets::sceneIndex)
                .containsExactly(0, 2);
    }

    @Test
    @DisplayName("합성이 종료 오류로 실패한 파이프라인은 재시도 시 합성부터 다시 진행")
    void retryPipelineResumesAssembly() {
        // given
        AtomicBoolean broken = new AtomicBoolean(true);
        adapters.get(StageType.ASSEMBLY).behave(input -> {
            if (broken.get()) {
                throw new TerminalStageException("codec mismatch", 422);
            }
            return adapters.get(StageType.ASSEMBLY).success(input);
        });
        PipelineScheduler scheduler = newScheduler();
        String jobId = scheduler.submit(submission(2));
        JobSnapshot failed = awaitStatus(jobId, PipelineStatus.FAILED);
        assertThat(failed.pipelineJob().getLastErrorKind()).isEqualTo(FailureKind.ASSEMBLY_FAILED);
        assertThat(failed.sceneJobs()).allMatch(SceneJob::isReady);

        // when
        broken.set(false);
        JobSnapshot reopened = scheduler.retryPipeline(jobId);

        // then
        assertThat(reopened.pipelineJob().getStatus()).isEqualTo(PipelineStatus.ASSEMBLING);
        JobSnapshot completed = awaitStatus(jobId, PipelineStatus.COMPLETED);
        assertThat(completed.pipelineJob().attemptsOf(StageType.ASSEMBLY)).isEqualTo(1);
        assertThat(adapters.get(StageType.VOICE).submitted()).hasSize(2);
    }

    @Test
    @DisplayName("비용 한도에 도달하면 다음 디스패치 전에 BUDGET_EXCEEDED 로 실패")
    void failsWhenBudgetExhausted() {
        // given
        adapters.get(StageType.SCRIPT).cost("0.0100");
        adapters.get(StageType.VOICE).cost("0.0100");
        PipelineScheduler scheduler = newScheduler();

        // when
        String jobId = scheduler.submit(PipelineSubmission.builder()
                .scriptRef("budget.md")
                .sceneText("one scene")
                .costBudget(new BigDecimal("0.0200"))
                .build());
        JobSnapshot snapshot = awaitStatus(jobId, PipelineStatus.FAILED);

        // then
        assertThat(snapshot.pipelineJob().getLastErrorKind()).isEqualTo(FailureKind.BUDGET_EXCEEDED);
        assertThat(adapters.get(StageType.VISUAL).submitted()).isEmpty();
        assertThatThrownBy(() -> scheduler.retryPipeline(jobId))
                .isInstanceOf(ApiException.class)
                .extracting(e -> ((ApiException) e).getErrorCode())
                .isEqualTo(ErrorCode.PIPELINE_NOT_RETRYABLE);
    }

    // ========== 제출 ==========

    @Test
    @DisplayName("같은 idempotencyKey 로 다시 제출하면 기존 작업 ID 를 반환")
    void submitIsIdempotent() {
        // given
        PipelineScheduler scheduler = newScheduler();
        PipelineSubmission submission = PipelineSubmission.builder()
                .scriptRef("same.md")
                .idempotencyKey("request-42")
                .sceneText("scene")
                .build();

        // when
        String first = scheduler.submit(submission);
        String second = scheduler.submit(submission);

        // then
        assertThat(second).isEqualTo(first);
    }

    @Test
    @DisplayName("씬이 없는 스크립트 제출은 SCRIPT_EMPTY")
    void rejectsEmptyScript() {
        PipelineScheduler scheduler = newScheduler();

        assertThatThrownBy(() -> scheduler.submit(PipelineSubmission.builder().scriptRef("empty.md").build()))
                .isInstanceOf(ApiException.class)
                .extracting(e -> ((ApiException) e).getErrorCode())
                .isEqualTo(ErrorCode.SCRIPT_EMPTY);
    }

    // ========== 동시성/순서 ==========

    @Test
    @DisplayName("단계별 동시 실행 수는 설정한 한도를 넘지 않는다")
    void respectsStageConcurrencyLimit() {
        // given
        properties.getConcurrency().put(StageType.VISUAL, 2);
        ScriptedStageAdapter visual = adapters.get(StageType.VISUAL);
        visual.behave(input -> {
            sleep(30);
            return visual.success(input);
        });
        PipelineScheduler scheduler = newScheduler();

        // when
        String jobId = scheduler.submit(submission(6));
        awaitStatus(jobId, PipelineStatus.COMPLETED);

        // then
        assertThat(visual.maxInFlight()).isLessThanOrEqualTo(2);
        assertThat(visual.submitted()).hasSize(6);
    }

    @Test
    @DisplayName("씬마다 단계 순서대로 STAGE_STARTED 가 STAGE_COMPLETED 보다 먼저 발행된다")
    void publishesEventsInStageOrder() throws InterruptedException {
        // given
        PipelineScheduler scheduler = newScheduler();
        ProgressSubscription subscription = broadcaster.subscribeAll();

        // when
        String jobId = scheduler.submit(submission(2));
        List<ProgressEvent> events = collectUntil(subscription, event -> event.getType() == ProgressEventType.JOB_COMPLETED);

        // then
        assertThat(events).extracting(ProgressEvent::getSequence).isSorted();
        assertThat(events.get(0).getType()).isEqualTo(ProgressEventType.JOB_STATUS_CHANGED);
        assertThat(events.get(0).getPipelineStatus()).isEqualTo(PipelineStatus.QUEUED);

        for (SceneJob scene : scheduler.getStatus(jobId).sceneJobs()) {
            List<ProgressEvent> sceneEvents = events.stream()
                    .filter(event -> scene.getSceneJobId().equals(event.getSceneJobId()))
                    .filter(event -> event.getType() == ProgressEventType.STAGE_STARTED
                            || event.getType() == ProgressEventType.STAGE_COMPLETED)
                    .toList();
            assertThat(sceneEvents)
                    .extracting(event -> event.getType() + ":" + event.getStage())
                    .containsExactly(
                            "STAGE_STARTED:SCRIPT", "STAGE_COMPLETED:SCRIPT",
                            "STAGE_STARTED:VOICE", "STAGE_COMPLETED:VOICE",
                            "STAGE_STARTED:VISUAL", "STAGE_COMPLETED:VISUAL",
                            "STAGE_STARTED:VIDEO_CLIP", "STAGE_COMPLETED:VIDEO_CLIP");
        }
        assertThat(events).filteredOn(event -> event.getType() == ProgressEventType.JOB_STATUS_CHANGED)
                .extracting(ProgressEvent::getPipelineStatus)
                .containsExactly(PipelineStatus.QUEUED, PipelineStatus.RUNNING,
                        PipelineStatus.ASSEMBLING, PipelineStatus.UPLOADING);
    }

    // ========== 재시작 복구 ==========

    @Test
    @DisplayName("재시작 후 복구 시 끊긴 호출은 시도 횟수를 올리지 않고 다시 실행된다")
    void recoversWithoutDoubleCountingAttempts() {
        // given
        ScriptedStageAdapter hangingVisual = adapters.get(StageType.VISUAL);
        hangingVisual.hold();
        PipelineScheduler first = newScheduler();
        String jobId = first.submit(submission(1));
        await(() -> hangingVisual.inFlight() == 1);
        await(() -> jobStore.load(jobId).map(s -> sceneAt(s, 0).getInFlightStage() == StageType.VISUAL).orElse(false));

        // when: 프로세스 중단 후 새 스케줄러로 재기동
        first.stop();
        adapters = newAdapters();
        PipelineScheduler second = newScheduler();
        int recovered = second.recover();

        // then
        assertThat(recovered).isEqualTo(1);
        JobSnapshot completed = awaitStatus(jobId, PipelineStatus.COMPLETED);
        assertThat(sceneAt(completed, 0).attemptsOf(StageType.VISUAL)).isEqualTo(1);
        assertThat(sceneAt(completed, 0).attemptsOf(StageType.VOICE)).isEqualTo(1);
        assertThat(adapters.get(StageType.VOICE).submitted()).isEmpty();
        assertThat(adapters.get(StageType.VISUAL).submitted()).hasSize(1);
        assertThat(jobStore.findAuditRecords(jobId))
                .filteredOn(record -> record.getOutcome() == StageOutcome.ABANDONED)
                .singleElement()
                .satisfies(record -> {
                    assertThat(record.getStage()).isEqualTo(StageType.VISUAL);
                    assertThat(record.getAttempt()).isEqualTo(1);
                });
        hangingVisual.release();
    }

    @Test
    @DisplayName("합성 중 재시작되면 끊긴 합성 호출을 ABANDONED 로 기록하고 같은 시도 번호로 다시 합성한다")
    void recoversInterruptedAssemblyWithAbandonedRecord() {
        // given
        ScriptedStageAdapter hangingAssembly = adapters.get(StageType.ASSEMBLY);
        hangingAssembly.hold();
        PipelineScheduler first = newScheduler();
        String jobId = first.submit(submission(1));
        await(() -> hangingAssembly.inFlight() == 1);
        await(() -> jobStore.load(jobId)
                .map(s -> s.pipelineJob().getInFlightStage() == StageType.ASSEMBLY)
                .orElse(false));

        // when
        first.stop();
        adapters = newAdapters();
        PipelineScheduler second = newScheduler();
        int recovered = second.recover();

        // then
        assertThat(recovered).isEqualTo(1);
        JobSnapshot completed = awaitStatus(jobId, PipelineStatus.COMPLETED);
        assertThat(completed.pipelineJob().attemptsOf(StageType.ASSEMBLY)).isEqualTo(1);
        assertThat(completed.pipelineJob().getInFlightStage()).isNull();
        assertThat(adapters.get(StageType.VISUAL).submitted()).isEmpty();
        assertThat(adapters.get(StageType.ASSEMBLY).submitted())
                .singleElement()
                .satisfies(input -> assertThat(input.getAttempt()).isEqualTo(1));
        assertThat(jobStore.findAuditRecords(jobId))
                .filteredOn(record -> record.getOutcome() == StageOutcome.ABANDONED)
                .singleElement()
                .satisfies(record -> {
                    assertThat(record.getStage()).isEqualTo(StageType.ASSEMBLY);
                    assertThat(record.getSceneJobId()).isNull();
                    assertThat(record.getAttempt()).isEqualTo(1);
                });
        hangingAssembly.release();
    }

    @Test
    @DisplayName("중단된 스케줄러는 제출을 거부한다")
    void rejectsSubmitWhenStopped() {
        PipelineScheduler scheduler = newScheduler();
        scheduler.stop();

        assertThatThrownBy(() -> scheduler.submit(submission(1)))
                .isInstanceOf(ApiException.class)
                .extracting(e -> ((ApiException) e).getErrorCode())
                .isEqualTo(ErrorCode.SCHEDULER_UNAVAILABLE);
    }

    // ========== 헬퍼 ==========

    private Map<StageType, ScriptedStageAdapter> newAdapters() {
        Map<StageType, ScriptedStageAdapter> map = new EnumMap<>(StageType.class);
        for (StageType stage : StageType.values()) {
            map.put(stage, new ScriptedStageAdapter(stage));
        }
        // 씬 분석: 본문을 나레이션/시각 프롬프트로 그대로 넘긴다
        ScriptedStageAdapter script = map.get(StageType.SCRIPT);
        script.behave(input -> PollResult.succeeded("test://analysis/" + input.getSceneIndex(), BigDecimal.ZERO, Map.of(
                SceneJob.INPUT_NARRATION, input.param(SceneJob.INPUT_SCENE_TEXT),
                SceneJob.INPUT_VISUAL_PROMPT, input.param(SceneJob.INPUT_SCENE_TEXT))));
        return map;
    }

    private PipelineScheduler newScheduler() {
        StagePacingService pacing = new StagePacingService(properties);
        pacing.init();
        PipelineScheduler scheduler = new PipelineScheduler(
                jobStore,
                new StageAdapterRegistry(new ArrayList<>(adapters.values())),
                new ExponentialBackoffRetryPolicy(properties),
                new PromptSanitizingFallback(properties),
                broadcaster,
                pacing,
                properties,
                new StageCallRunner(workers, cancellers, timer, properties),
                timer);
        scheduler.start();
        schedulers.add(scheduler);
        return scheduler;
    }

    private PipelineSubmission submission(int sceneCount) {
        PipelineSubmission.PipelineSubmissionBuilder builder = PipelineSubmission.builder()
                .scriptRef("test-script.md")
                .scriptTitle("Test Script");
        for (int i = 0; i < sceneCount; i++) {
            builder.sceneText("Scene " + i + ": a quiet harbor at dawn.");
        }
        return builder.build();
    }

    private JobSnapshot awaitStatus(String jobId, PipelineStatus status) {
        await(() -> jobStore.load(jobId).map(s -> s.pipelineJob().getStatus() == status).orElse(false));
        return jobStore.load(jobId).orElseThrow();
    }

    private long countStage(String jobId, SceneStage stage) {
        return jobStore.load(jobId)
                .map(snapshot -> snapshot.sceneJobs().stream().filter(scene -> scene.getCurrentStage() == stage).count())
                .orElse(0L);
    }

    private static SceneJob sceneAt(JobSnapshot snapshot, int sceneIndex) {
        return snapshot.sceneJobs().stream()
                .filter(scene -> scene.getSceneIndex() == sceneIndex)
                .findFirst()
                .orElseThrow();
    }

    private static List<ProgressEvent> collectUntil(ProgressSubscription subscription, Predicate<ProgressEvent> last)
            throws InterruptedException {
        List<ProgressEvent> events = new ArrayList<>();
        long deadline = System.currentTimeMillis() + AWAIT_TIMEOUT_MS;
        while (System.currentTimeMillis() < deadline) {
            ProgressEvent event = subscription.poll(100, TimeUnit.MILLISECONDS);
            if (event == null) {
                continue;
            }
            events.add(event);
            if (last.test(event)) {
                return events;
            }
        }
        return fail("Expected event did not arrive; received " + events.size() + " events");
    }

    private static void await(BooleanSupplier condition) {
        long deadline = System.currentTimeMillis() + AWAIT_TIMEOUT_MS;
        while (!condition.getAsBoolean()) {
            if (System.currentTimeMillis() > deadline) {
                fail("Condition not met within " + AWAIT_TIMEOUT_MS + "ms");
            }
            sleep(10);
        }
    }

    private static void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
