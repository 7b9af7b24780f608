package com.videopipe.orchestrator.service.scheduler;

import com.videopipe.common.enums.FailureKind;
import com.videopipe.common.enums.PipelineStatus;
import com.videopipe.common.enums.SceneStage;
import com.videopipe.common.enums.StageOutcome;
import com.videopipe.common.enums.StageType;
import com.videopipe.common.exception.ApiException;
import com.videopipe.common.exception.ErrorCode;
import com.videopipe.orchestrator.config.PipelineProperties;
import com.videopipe.orchestrator.entity.PipelineJob;
import com.videopipe.orchestrator.entity.SceneJob;
import com.videopipe.orchestrator.entity.StageCallRecord;
import com.videopipe.orchestrator.service.adapter.PollResult;
import com.videopipe.orchestrator.service.adapter.StageAdapter;
import com.videopipe.orchestrator.service.adapter.StageAdapterRegistry;
import com.videopipe.orchestrator.service.adapter.StageInput;
import com.videopipe.orchestrator.service.error.ModerationRejectedException;
import com.videopipe.orchestrator.service.moderation.ModerationFallback;
import com.videopipe.orchestrator.service.progress.ProgressBroadcaster;
import com.videopipe.orchestrator.service.progress.ProgressEvent;
import com.videopipe.orchestrator.service.progress.ProgressEventType;
import com.videopipe.orchestrator.service.retry.ErrorClassification;
import com.videopipe.orchestrator.service.retry.RetryPolicy;
import com.videopipe.orchestrator.service.retry.StagePacingService;
import com.videopipe.orchestrator.service.store.JobSnapshot;
import com.videopipe.orchestrator.service.store.JobStore;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * 파이프라인 오케스트레이션 엔진
 *
 * 씬 작업을 단계별 대기열에 넣고, 단계별 동시 실행 한도 안에서 어댑터 호출을 디스패치한다.
 * 호출 결과에 따라 재시도(백오프), 모더레이션 대체 입력, 실패 처리를 적용하고
 * 모든 씬이 준비되면 합성 → 업로드로 진행한다.
 *
 * 규칙:
 * - 작업 단위 잠금 안에서만 상태를 바꾼다 (씬 작업당 단일 writer)
 * - 상태 전이는 JobStore 에 먼저 저장한 뒤 이벤트를 발행한다
 * - 백오프 대기 중에는 슬롯을 잡지 않는다
 * - 시도 횟수는 호출이 끝났을 때만 올린다 (취소/재시작으로 끊긴 호출은 세지 않음)
 */
@Slf4j
@Service
public class PipelineScheduler {

    private static final long DISPATCH_IDLE_WAIT_MS = 500;
    private static final int MAX_ERROR_LENGTH = 1000;

    private final JobStore jobStore;
    private final StageAdapterRegistry adapterRegistry;
    private final RetryPolicy retryPolicy;
    private final ModerationFallback moderationFallback;
    private final ProgressBroadcaster broadcaster;
    private final StagePacingService pacingService;
    private final PipelineProperties properties;
    private final StageCallRunner callRunner;
    private final ScheduledExecutorService timer;

    private final Map<StageType, StageLane> lanes = new EnumMap<>(StageType.class);
    private final Map<String, ActiveJob> activeJobs = new ConcurrentHashMap<>();
    private final AtomicLong ticketSequence = new AtomicLong();
    private final Semaphore wakeup = new Semaphore(0);
    private final Object submitLock = new Object();

    private volatile boolean running;
    private Thread dispatcher;

    public PipelineScheduler(JobStore jobStore,
                             StageAdapterRegistry adapterRegistry,
                             RetryPolicy retryPolicy,
                             ModerationFallback moderationFallback,
                             ProgressBroadcaster broadcaster,
                             StagePacingService pacingService,
                             PipelineProperties properties,
                             StageCallRunner callRunner,
                             @Qualifier("pipelineTimer") ScheduledExecutorService timer) {
        this.jobStore = jobStore;
        this.adapterRegistry = adapterRegistry;
        this.retryPolicy = retryPolicy;
        this.moderationFallback = moderationFallback;
        this.broadcaster = broadcaster;
        this.pacingService = pacingService;
        this.properties = properties;
        this.callRunner = callRunner;
        this.timer = timer;
    }

    // ========== 생명주기 ==========

    @PostConstruct
    public synchronized void start() {
        if (running) {
            return;
        }
        for (StageType stage : StageType.values()) {
            lanes.put(stage, new StageLane(stage, properties.concurrencyOf(stage)));
        }
        running = true;
        dispatcher = new Thread(this::dispatchLoop, "pipeline-dispatcher");
        dispatcher.setDaemon(true);
        dispatcher.start();
        log.info("[Scheduler] Started - concurrency: {}", properties.getConcurrency());
    }

    /**
     * 디스패치 중단. 진행 중인 호출 결과는 더 이상 반영하지 않으며,
     * 저장된 상태는 다음 기동 시 recover() 로 이어서 진행된다.
     */
    @PreDestroy
    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;
        if (dispatcher != null) {
            dispatcher.interrupt();
        }
        activeJobs.values().forEach(active -> {
            active.lock();
            try {
                active.clearPending();
            } finally {
                active.unlock();
            }
        });
        activeJobs.clear();
        log.info("[Scheduler] Stopped");
    }

    public boolean isRunning() {
        return running;
    }

    // ========== 컨트롤 API ==========

    /**
     * 작업 제출. 씬마다 SceneJob 을 만들어 저장한 뒤 SCRIPT 대기열에 넣는다.
     *
     * @return 작업 ID (같은 idempotencyKey 로 다시 제출하면 기존 ID)
     */
    public String submit(PipelineSubmission submission) {
        ensureRunning();
        if (submission.getScriptRef() == null || submission.getScriptRef().isBlank()) {
            throw new ApiException(ErrorCode.INVALID_REQUEST, "scriptRef 가 비어 있습니다.");
        }
        if (submission.getSceneTexts().isEmpty()) {
            throw new ApiException(ErrorCode.SCRIPT_EMPTY);
        }

        synchronized (submitLock) {
            if (submission.getIdempotencyKey() != null) {
                String existing = jobStore.findJobIdByIdempotencyKey(submission.getIdempotencyKey()).orElse(null);
                if (existing != null) {
                    log.info("[Scheduler] Duplicate submission (key={}) → existing job {}",
                            submission.getIdempotencyKey(), existing);
                    return existing;
                }
            }

            LocalDateTime now = LocalDateTime.now();
            String jobId = UUID.randomUUID().toString();

            List<SceneJob> scenes = new ArrayList<>();
            for (int i = 0; i < submission.getSceneTexts().size(); i++) {
                SceneJob scene = SceneJob.builder()
                        .sceneJobId(UUID.randomUUID().toString())
                        .pipelineJobId(jobId)
                        .sceneIndex(i)
                        .currentStage(SceneStage.SCRIPT)
                        .createdAt(now)
                        .updatedAt(now)
                        .build();
                scene.getInputs().put(SceneJob.INPUT_SCENE_TEXT, submission.getSceneTexts().get(i));
                if (submission.getScriptTitle() != null) {
                    scene.getInputs().put(SceneJob.INPUT_TITLE, submission.getScriptTitle());
                }
                scenes.add(scene);
            }

            PipelineJob job = PipelineJob.builder()
                    .jobId(jobId)
                    .scriptRef(submission.getScriptRef())
                    .scriptTitle(submission.getScriptTitle())
                    .idempotencyKey(submission.getIdempotencyKey())
                    .status(PipelineStatus.QUEUED)
                    .allowPartialAssembly(submission.getAllowPartialAssembly() != null
                            ? submission.getAllowPartialAssembly()
                            : properties.getAssemblyPolicy() == PipelineProperties.AssemblyPolicy.OMIT_FAILED)
                    .costAccumulated(BigDecimal.ZERO)
                    .costBudget(submission.getCostBudget() != null ? submission.getCostBudget() : properties.getCostBudget())
                    .sceneJobIds(scenes.stream().map(SceneJob::getSceneJobId).collect(Collectors.toList()))
                    .createdAt(now)
                    .updatedAt(now)
                    .build();

            jobStore.save(job, scenes);

            ActiveJob active = new ActiveJob(job, scenes);
            activeJobs.put(jobId, active);
            active.lock();
            try {
                broadcaster.publish(jobEvent(ProgressEventType.JOB_STATUS_CHANGED, job).build());
                scenes.forEach(scene -> enqueueScene(active, scene));
            } finally {
                active.unlock();
            }

            log.info("[Scheduler] Job {} submitted - script={}, scenes={}, partialAssembly={}",
                    jobId, submission.getScriptRef(), scenes.size(), job.isAllowPartialAssembly());
            return jobId;
        }
    }

    public JobSnapshot getStatus(String jobId) {
        return jobStore.load(jobId)
                .orElseThrow(() -> new ApiException(ErrorCode.PIPELINE_NOT_FOUND));
    }

    public List<StageCallRecord> getAuditTrail(String jobId) {
        getStatus(jobId);
        return jobStore.findAuditRecords(jobId);
    }

    /**
     * 작업 취소. 새 디스패치를 막고 진행 중인 호출은 포기(벤더 취소 요청)한다.
     * 이미 만들어진 결과물은 그대로 남는다.
     */
    public JobSnapshot cancel(String jobId) {
        ActiveJob active = activate(jobId);
        active.lock();
        try {
            PipelineJob job = active.getJob();
            if (job.getStatus() == PipelineStatus.CANCELLED) {
                return active.snapshot();
            }
            if (job.getStatus() == PipelineStatus.COMPLETED) {
                throw new ApiException(ErrorCode.PIPELINE_ALREADY_FINISHED);
            }

            transition(job, PipelineStatus.CANCELLED);
            jobStore.savePipelineJob(job);

            active.clearPending();
            List<InFlightCall> calls = active.inFlightCalls();
            calls.forEach(callRunner::cancel);

            broadcaster.publish(jobEvent(ProgressEventType.JOB_CANCELLED, job)
                    .message(calls.size() + " in-flight call(s) abandoned")
                    .build());
            log.info("[Scheduler] Job {} cancelled - {} in-flight call(s) abandoned", jobId, calls.size());

            return active.snapshot();
        } finally {
            releaseIfIdle(active);
            active.unlock();
        }
    }

    /**
     * 실패한 씬을 실패 단계부터 새 시도 횟수로 다시 진행.
     * READY 이거나 진행 중인 씬이면 아무것도 하지 않는다.
     *
     * @param inputOverrides 교체할 입력 (예: 다른 표현으로 바꾼 프롬프트). null 가능
     */
    public JobSnapshot retryFailedScene(String sceneJobId, Map<String, String> inputOverrides) {
        ensureRunning();
        SceneJob stored = jobStore.findSceneJob(sceneJobId)
                .orElseThrow(() -> new ApiException(ErrorCode.SCENE_JOB_NOT_FOUND));
        ActiveJob active = activate(stored.getPipelineJobId());

        active.lock();
        try {
            PipelineJob job = active.getJob();
            SceneJob scene = active.scene(sceneJobId);
            if (scene == null) {
                throw new ApiException(ErrorCode.SCENE_JOB_NOT_FOUND);
            }
            if (!scene.isFailed()) {
                log.info("[Scheduler] Retry of scene {} ignored - stage {}", sceneJobId, scene.getCurrentStage());
                return active.snapshot();
            }

            PipelineStatus status = job.getStatus();
            if (status.isFinal()) {
                throw new ApiException(ErrorCode.PIPELINE_ALREADY_FINISHED);
            }
            if (status == PipelineStatus.ASSEMBLING || status == PipelineStatus.UPLOADING
                    || (status == PipelineStatus.FAILED && job.getLastErrorKind() != FailureKind.SCENE_FAILED)) {
                throw new ApiException(ErrorCode.SCENE_NOT_RETRYABLE,
                        "파이프라인이 " + status.getDescription() + " 상태라 씬을 재시도할 수 없습니다.");
            }

            resetScene(scene, inputOverrides);
            boolean reopened = reopenIfFailed(job, PipelineStatus.RUNNING);
            jobStore.save(job, List.of(scene));

            if (reopened) {
                broadcaster.publish(jobEvent(ProgressEventType.JOB_STATUS_CHANGED, job)
                        .message("Reopened by scene retry").build());
            }
            enqueueScene(active, scene);
            log.info("[Scheduler] Scene {} (index {}) retried from {}",
                    sceneJobId, scene.getSceneIndex(), scene.getCurrentStage());
            return active.snapshot();
        } finally {
            releaseIfIdle(active);
            active.unlock();
        }
    }

    /**
     * 실패한 파이프라인 재시도: 합성/업로드 실패면 해당 단계부터, 씬 실패면 실패한 씬 전부.
     */
    public JobSnapshot retryPipeline(String jobId) {
        ensureRunning();
        ActiveJob active = activate(jobId);
        active.lock();
        try {
            PipelineJob job = active.getJob();
            if (job.getStatus() != PipelineStatus.FAILED) {
                throw new ApiException(ErrorCode.PIPELINE_NOT_RETRYABLE);
            }

            FailureKind kind = job.getLastErrorKind();
            if (kind == FailureKind.ASSEMBLY_FAILED || kind == FailureKind.UPLOAD_FAILED) {
                StageType stage = kind == FailureKind.ASSEMBLY_FAILED ? StageType.ASSEMBLY : StageType.UPLOAD;
                job.getStageAttempts().put(stage, 0);
                reopenIfFailed(job, stage == StageType.ASSEMBLY ? PipelineStatus.ASSEMBLING : PipelineStatus.UPLOADING);
                jobStore.savePipelineJob(job);
                broadcaster.publish(jobEvent(ProgressEventType.JOB_STATUS_CHANGED, job)
                        .message("Retrying " + stage).build());
                enqueuePipelineStage(active, stage);
            } else if (kind == FailureKind.SCENE_FAILED) {
                List<SceneJob> failed = active.scenes().stream().filter(SceneJob::isFailed).toList();
                failed.forEach(scene -> resetScene(scene, null));
                reopenIfFailed(job, PipelineStatus.RUNNING);
                jobStore.save(job, failed);
                broadcaster.publish(jobEvent(ProgressEventType.JOB_STATUS_CHANGED, job)
                        .message("Retrying " + failed.size() + " failed scene(s)").build());
                failed.forEach(scene -> enqueueScene(active, scene));
            } else {
                throw new ApiException(ErrorCode.PIPELINE_NOT_RETRYABLE,
                        "재시도할 수 없는 실패입니다: " + (kind != null ? kind.getUserGuidance() : "알 수 없음"));
            }

            log.info("[Scheduler] Job {} reopened after {} → {}", jobId, kind, job.getStatus());
            return active.snapshot();
        } finally {
            releaseIfIdle(active);
            active.unlock();
        }
    }

    /**
     * 재시작 후 미완료 작업을 저장된 단계/시도 횟수에서 이어서 진행.
     * 끊긴 호출은 ABANDONED 로 기록하고 시도 횟수를 올리지 않은 채 다시 디스패치한다.
     */
    public int recover() {
        ensureRunning();
        int recovered = 0;
        for (String jobId : jobStore.findRecoverableJobIds()) {
            try {
                if (recoverJob(jobId)) {
                    recovered++;
                }
            } catch (RuntimeException e) {
                log.error("[Scheduler] Failed to recover job {}: {}", jobId, e.getMessage(), e);
            }
        }
        log.info("[Scheduler] Recovery complete - {} job(s) resumed", recovered);
        return recovered;
    }

    /**
     * 단계별 대기/진행 현황
     */
    public Map<StageType, LaneStats> getLaneStats() {
        Map<StageType, LaneStats> stats = new EnumMap<>(StageType.class);
        lanes.forEach((stage, lane) -> stats.put(stage,
                new LaneStats(lane.getQueued(), lane.getInFlight(), lane.getLimit())));
        return stats;
    }

    public record LaneStats(int queued, int inFlight, int limit) {
    }

    // ========== 디스패치 ==========

    private void dispatchLoop() {
        while (running) {
            try {
                wakeup.tryAcquire(DISPATCH_IDLE_WAIT_MS, TimeUnit.MILLISECONDS);
                wakeup.drainPermits();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
            for (StageLane lane : lanes.values()) {
                try {
                    drainLane(lane);
                } catch (RuntimeException e) {
                    log.error("[Scheduler] Dispatch error on {} lane: {}", lane.getStage(), e.getMessage(), e);
                }
            }
        }
        log.debug("[Scheduler] Dispatcher exited");
    }

    private void drainLane(StageLane lane) {
        while (running && lane.hasQueued() && lane.tryAcquireSlot()) {
            long waitMs = pacingService.tryAcquire(lane.getStage());
            if (waitMs > 0) {
                lane.releaseSlot();
                scheduleWakeup(waitMs);
                return;
            }

            DispatchTicket ticket = lane.poll();
            if (ticket == null) {
                lane.releaseSlot();
                return;
            }

            boolean launched = false;
            try {
                launched = launch(lane, ticket);
            } catch (RuntimeException e) {
                log.error("[Scheduler] Failed to launch {} for {}: {}",
                        ticket.stage(), ticket.key(), e.getMessage(), e);
            } finally {
                if (!launched) {
                    lane.releaseSlot();
                }
            }
        }
    }

    private boolean launch(StageLane lane, DispatchTicket ticket) {
        ActiveJob active = activeJobs.get(ticket.pipelineJobId());
        if (active == null) {
            return false;
        }

        active.lock();
        try {
            active.unmarkQueued(ticket.key());
            PipelineJob job = active.getJob();
            if (job.getStatus().isSettled() || active.isInFlight(ticket.key())) {
                return false;
            }
            if (job.isBudgetExhausted()) {
                failPipeline(active, FailureKind.BUDGET_EXCEEDED,
                        "Cost budget " + job.getCostBudget() + " reached (spent " + job.getCostAccumulated() + ")");
                return false;
            }
            return ticket.isSceneStage()
                    ? launchSceneStage(lane, active, ticket)
                    : launchPipelineStage(lane, active, ticket);
        } finally {
            releaseIfIdle(active);
            active.unlock();
        }
    }

    private boolean launchSceneStage(StageLane lane, ActiveJob active, DispatchTicket ticket) {
        PipelineJob job = active.getJob();
        SceneJob scene = active.scene(ticket.sceneJobId());
        StageType stage = ticket.stage();
        if (scene == null || scene.isTerminal() || scene.getCurrentStage().getStageType() != stage) {
            return false;
        }

        boolean started = job.getStatus() == PipelineStatus.QUEUED;
        if (started) {
            transition(job, PipelineStatus.RUNNING);
        }

        StageAdapter adapter;
        try {
            adapter = adapterRegistry.get(stage);
        } catch (ApiException e) {
            if (started) {
                jobStore.savePipelineJob(job);
                broadcaster.publish(jobEvent(ProgressEventType.JOB_STATUS_CHANGED, job).build());
            }
            failScene(active, scene, stage, null, null, FailureKind.TERMINAL, StageOutcome.TERMINAL_FAILURE, e.getMessage());
            return false;
        }

        int attempt = scene.attemptsOf(stage) + 1;
        scene.setInFlightStage(stage);
        scene.setUpdatedAt(LocalDateTime.now());
        if (started) {
            jobStore.save(job, List.of(scene));
            broadcaster.publish(jobEvent(ProgressEventType.JOB_STATUS_CHANGED, job).build());
        } else {
            jobStore.saveSceneJob(scene);
        }
        broadcaster.publish(sceneEvent(ProgressEventType.STAGE_STARTED, job, scene, stage, attempt).build());

        StageInput input = StageInput.builder()
                .pipelineJobId(job.getJobId())
                .sceneJobId(scene.getSceneJobId())
                .sceneIndex(scene.getSceneIndex())
                .stage(stage)
                .attempt(attempt)
                .params(scene.getInputs())
                .priorAssets(scene.getAssets())
                .deadline(Instant.now().plus(properties.timeoutOf(stage)))
                .build();

        log.debug("[Scheduler] Dispatch {} scene={} attempt={} (job {})",
                stage, scene.getSceneIndex(), attempt, job.getJobId());
        startCall(lane, active, adapter, input, ticket.key());
        return true;
    }

    private boolean launchPipelineStage(StageLane lane, ActiveJob active, DispatchTicket ticket) {
        PipelineJob job = active.getJob();
        StageType stage = ticket.stage();
        PipelineStatus expected = stage == StageType.ASSEMBLY ? PipelineStatus.ASSEMBLING : PipelineStatus.UPLOADING;
        if (job.getStatus() != expected) {
            return false;
        }

        StageAdapter adapter;
        try {
            adapter = adapterRegistry.get(stage);
        } catch (ApiException e) {
            failPipeline(active, failureKindOf(stage), e.getMessage());
            return false;
        }

        int attempt = job.attemptsOf(stage) + 1;
        StageInput.StageInputBuilder input = StageInput.builder()
                .pipelineJobId(job.getJobId())
                .stage(stage)
                .attempt(attempt)
                .priorAssets(job.getStageAssets())
                .deadline(Instant.now().plus(properties.timeoutOf(stage)));
        if (job.getScriptTitle() != null) {
            input.param(SceneJob.INPUT_TITLE, job.getScriptTitle());
        }
        if (stage == StageType.ASSEMBLY) {
            active.scenes().stream()
                    .filter(SceneJob::isReady)
                    .sorted(Comparator.comparing(SceneJob::getSceneIndex))
                    .forEach(scene -> input.sceneAsset(new StageInput.SceneAssets(
                            scene.getSceneIndex(), scene.getSceneJobId(), Map.copyOf(scene.getAssets()))));
        }

        job.setInFlightStage(stage);
        job.setUpdatedAt(LocalDateTime.now());
        jobStore.savePipelineJob(job);
        broadcaster.publish(jobEvent(ProgressEventType.STAGE_STARTED, job).stage(stage).attempt(attempt).build());
        log.info("[Scheduler] Dispatch {} attempt={} (job {})", stage, attempt, job.getJobId());
        startCall(lane, active, adapter, input.build(), ticket.key());
        return true;
    }

    private void startCall(StageLane lane, ActiveJob active, StageAdapter adapter, StageInput input, String key) {
        InFlightCall call = callRunner.start(adapter, input, key,
                percent -> onProgress(active, input, key, percent));
        active.putInFlight(call);
        call.getFuture().whenComplete((outcome, error) -> onCallFinished(lane, active, call,
                outcome != null ? outcome : CallOutcome.failed(error, 0)));
    }

    // ========== 결과 처리 ==========

    private void onProgress(ActiveJob active, StageInput input, String key, int percent) {
        if (!running) {
            return;
        }
        active.lock();
        try {
            PipelineJob job = active.getJob();
            if (job.getStatus().isSettled() || !active.isInFlight(key)) {
                return;
            }
            ProgressEvent.ProgressEventBuilder event = jobEvent(ProgressEventType.STAGE_PROGRESS, job)
                    .stage(input.getStage())
                    .attempt(input.getAttempt())
                    .percent(percent);
            if (input.getSceneJobId() != null) {
                event.sceneJobId(input.getSceneJobId()).sceneIndex(input.getSceneIndex());
            }
            broadcaster.publish(event.build());
        } finally {
            active.unlock();
        }
    }

    private void onCallFinished(StageLane lane, ActiveJob active, InFlightCall call, CallOutcome outcome) {
        lane.releaseSlot();
        signal();
        if (!running) {
            return;
        }

        active.lock();
        try {
            active.removeInFlight(call);
            PipelineJob job = active.getJob();

            if (outcome.getStatus() == CallOutcome.Status.ABANDONED || job.getStatus().isSettled()) {
                handleAbandoned(active, call, outcome);
            } else if (outcome.getStatus() == CallOutcome.Status.SUCCEEDED) {
                pacingService.recordSuccess(call.getStage());
                if (call.getSceneJobId() != null) {
                    handleSceneSuccess(active, call, outcome);
                } else {
                    handlePipelineSuccess(active, call, outcome);
                }
            } else {
                pacingService.recordFailure(call.getStage(), outcome.getError());
                if (call.getSceneJobId() != null) {
                    handleSceneFailure(active, call, outcome);
                } else {
                    handlePipelineFailure(active, call, outcome);
                }
            }
            releaseIfIdle(active);
        } catch (RuntimeException e) {
            log.error("[Scheduler] Failed to apply {} outcome for {} (job {}): {}",
                    call.getStage(), call.getKey(), active.getJobId(), e.getMessage(), e);
        } finally {
            active.unlock();
        }
    }

    private void handleAbandoned(ActiveJob active, InFlightCall call, CallOutcome outcome) {
        if (call.getSceneJobId() != null) {
            SceneJob scene = active.scene(call.getSceneJobId());
            if (scene != null && scene.getInFlightStage() == call.getStage()) {
                scene.setInFlightStage(null);
                scene.setUpdatedAt(LocalDateTime.now());
                jobStore.saveSceneJob(scene);
            }
        } else if (active.getJob().getInFlightStage() == call.getStage()) {
            active.getJob().setInFlightStage(null);
            active.getJob().setUpdatedAt(LocalDateTime.now());
            jobStore.savePipelineJob(active.getJob());
        }
        audit(call, outcome, StageOutcome.ABANDONED, "Call abandoned (job " + active.getJob().getStatus() + ")");
        log.info("[Scheduler] {} call for {} abandoned after {}ms", call.getStage(), call.getKey(), outcome.getLatencyMs());
    }

    private void handleSceneSuccess(ActiveJob active, InFlightCall call, CallOutcome outcome) {
        PipelineJob job = active.getJob();
        SceneJob scene = active.scene(call.getSceneJobId());
        StageType stage = call.getStage();
        PollResult result = outcome.getResult();

        scene.setInFlightStage(null);
        scene.getAttempts().put(stage, call.getAttempt());
        scene.getAssets().put(stage, result.getAssetRef());
        scene.getInputs().putAll(result.getOutputs());
        scene.setLastError(null);
        scene.setLastErrorKind(null);
        scene.setCurrentStage(scene.getCurrentStage().next());
        scene.setUpdatedAt(LocalDateTime.now());
        job.addCost(result.getCostDelta());
        job.setUpdatedAt(LocalDateTime.now());

        jobStore.save(job, List.of(scene));
        audit(call, outcome, StageOutcome.SUCCESS, null);
        broadcaster.publish(sceneEvent(ProgressEventType.STAGE_COMPLETED, job, scene, stage, call.getAttempt())
                .percent(100)
                .message(result.getAssetRef())
                .build());

        log.info("[Scheduler] Scene {} {} completed (attempt {}, {}ms) → {}",
                scene.getSceneIndex(), stage, call.getAttempt(), outcome.getLatencyMs(), scene.getCurrentStage());

        if (scene.isReady()) {
            checkReadiness(active);
        } else {
            enqueueScene(active, scene);
        }
    }

    private void handleSceneFailure(ActiveJob active, InFlightCall call, CallOutcome outcome) {
        PipelineJob job = active.getJob();
        SceneJob scene = active.scene(call.getSceneJobId());
        StageType stage = call.getStage();
        int attempt = call.getAttempt();
        Throwable error = outcome.getError();
        String message = describe(error);

        scene.setInFlightStage(null);
        scene.getAttempts().put(stage, attempt);
        scene.setUpdatedAt(LocalDateTime.now());

        ErrorClassification classification = retryPolicy.classify(error);
        int maxAttempts = retryPolicy.maxAttempts(stage);

        // 대체 입력으로 한 번 더 시도한 결과도 실패면 종료
        if (scene.getFallbackUsed().contains(stage)) {
            FailureKind kind = classification == ErrorClassification.MODERATION_REJECTED
                    ? FailureKind.MODERATION_REJECTED
                    : kindOf(classification);
            failScene(active, scene, stage, call, outcome, kind, auditOutcomeOf(classification),
                    "Fallback attempt failed: " + message);
            return;
        }

        switch (classification) {
            case MODERATION_REJECTED -> {
                // 대체 시도는 일반 재시도 한도와 별개 (마지막 시도에서 거부돼도 한 번 더)
                ModerationRejectedException rejection = error instanceof ModerationRejectedException moderation
                        ? moderation
                        : new ModerationRejectedException("UNKNOWN", null, List.of());
                scene.setInputs(moderationFallback.rewrite(stage, scene.getInputs(), rejection));
                scene.getFallbackUsed().add(stage);
                scene.setLastError(message);
                scene.setLastErrorKind(FailureKind.MODERATION_REJECTED);
                jobStore.saveSceneJob(scene);
                audit(call, outcome, StageOutcome.MODERATION_REJECTED, message);
                broadcaster.publish(sceneEvent(ProgressEventType.STAGE_FAILED, job, scene, stage, attempt)
                        .willRetry(true)
                        .retryDelayMs(0L)
                        .errorKind(FailureKind.MODERATION_REJECTED)
                        .message("Moderation rejected; retrying once with sanitized input")
                        .build());
                log.warn("[Scheduler] Scene {} {} moderation rejected (attempt {}), retrying with fallback input",
                        scene.getSceneIndex(), stage, attempt);
                enqueueScene(active, scene);
            }
            case RETRYABLE -> {
                if (attempt >= maxAttempts) {
                    failScene(active, scene, stage, call, outcome, FailureKind.INFRASTRUCTURE,
                            StageOutcome.RETRYABLE_FAILURE, "Retries exhausted after " + attempt + " attempts: " + message);
                    return;
                }
                Duration delay = retryPolicy.nextDelay(stage, attempt);
                scene.setLastError(message);
                scene.setLastErrorKind(FailureKind.INFRASTRUCTURE);
                jobStore.saveSceneJob(scene);
                audit(call, outcome, StageOutcome.RETRYABLE_FAILURE, message);
                broadcaster.publish(sceneEvent(ProgressEventType.STAGE_FAILED, job, scene, stage, attempt)
                        .willRetry(true)
                        .retryDelayMs(delay.toMillis())
                        .errorKind(FailureKind.INFRASTRUCTURE)
                        .message(message)
                        .build());
                log.warn("[Scheduler] Scene {} {} failed (attempt {}/{}), retry in {}ms: {}",
                        scene.getSceneIndex(), stage, attempt, maxAttempts, delay.toMillis(), message);
                scheduleRetry(active, scene.getSceneJobId(), delay, () -> enqueueScene(active, scene));
            }
            case TERMINAL -> failScene(active, scene, stage, call, outcome, FailureKind.TERMINAL,
                    StageOutcome.TERMINAL_FAILURE, message);
        }
    }

    private void failScene(ActiveJob active, SceneJob scene, StageType stage, InFlightCall call, CallOutcome outcome,
                           FailureKind kind, StageOutcome auditOutcome, String message) {
        PipelineJob job = active.getJob();
        scene.setInFlightStage(null);
        scene.setCurrentStage(SceneStage.FAILED);
        scene.setFailedStage(stage);
        scene.setLastError(truncate(kind.getUserGuidance() + " (" + message + ")"));
        scene.setLastErrorKind(kind);
        scene.setUpdatedAt(LocalDateTime.now());

        jobStore.saveSceneJob(scene);
        if (call != null) {
            audit(call, outcome, auditOutcome, message);
        }
        broadcaster.publish(sceneEvent(ProgressEventType.STAGE_FAILED, job, scene, stage, scene.attemptsOf(stage))
                .willRetry(false)
                .errorKind(kind)
                .message(scene.getLastError())
                .build());
        log.error("[Scheduler] Scene {} failed at {} after {} attempt(s) [{}]: {}",
                scene.getSceneIndex(), stage, scene.attemptsOf(stage), kind, message);

        checkReadiness(active);
    }

    /**
     * 모든 씬이 종료 상태가 되면 합성 진행 여부 결정
     */
    private void checkReadiness(ActiveJob active) {
        PipelineJob job = active.getJob();
        if (job.getStatus() != PipelineStatus.RUNNING) {
            return;
        }
        if (active.scenes().stream().anyMatch(scene -> !scene.isTerminal())) {
            return;
        }

        long ready = active.scenes().stream().filter(SceneJob::isReady).count();
        long failed = active.scenes().size() - ready;

        if (ready == 0) {
            failPipeline(active, FailureKind.SCENE_FAILED, "All " + failed + " scene(s) failed");
            return;
        }
        if (failed > 0 && !job.isAllowPartialAssembly()) {
            failPipeline(active, FailureKind.SCENE_FAILED,
                    failed + " of " + active.scenes().size() + " scene(s) failed; retry them to resume");
            return;
        }

        transition(job, PipelineStatus.ASSEMBLING);
        jobStore.savePipelineJob(job);
        broadcaster.publish(jobEvent(ProgressEventType.JOB_STATUS_CHANGED, job)
                .message(failed > 0 ? "Assembling " + ready + " scene(s), " + failed + " omitted" : null)
                .build());
        log.info("[Scheduler] Job {} assembling {} scene(s) ({} omitted)", job.getJobId(), ready, failed);
        enqueuePipelineStage(active, StageType.ASSEMBLY);
    }

    private void handlePipelineSuccess(ActiveJob active, InFlightCall call, CallOutcome outcome) {
        PipelineJob job = active.getJob();
        StageType stage = call.getStage();
        PollResult result = outcome.getResult();

        job.setInFlightStage(null);
        job.getStageAttempts().put(stage, call.getAttempt());
        job.getStageAssets().put(stage, result.getAssetRef());
        job.addCost(result.getCostDelta());
        job.setLastError(null);
        job.setLastErrorKind(null);

        if (stage == StageType.ASSEMBLY) {
            transition(job, PipelineStatus.UPLOADING);
        } else {
            job.setFinalAssetRef(result.getAssetRef());
            transition(job, PipelineStatus.COMPLETED);
            job.setCompletedAt(LocalDateTime.now());
        }

        jobStore.savePipelineJob(job);
        audit(call, outcome, StageOutcome.SUCCESS, null);
        broadcaster.publish(jobEvent(ProgressEventType.STAGE_COMPLETED, job)
                .stage(stage).attempt(call.getAttempt()).percent(100).message(result.getAssetRef()).build());

        if (stage == StageType.ASSEMBLY) {
            broadcaster.publish(jobEvent(ProgressEventType.JOB_STATUS_CHANGED, job).build());
            enqueuePipelineStage(active, StageType.UPLOAD);
        } else {
            broadcaster.publish(jobEvent(ProgressEventType.JOB_COMPLETED, job).message(job.getFinalAssetRef()).build());
            log.info("[Scheduler] Job {} completed - asset={}, cost={}",
                    job.getJobId(), job.getFinalAssetRef(), job.getCostAccumulated());
        }
    }

    private void handlePipelineFailure(ActiveJob active, InFlightCall call, CallOutcome outcome) {
        PipelineJob job = active.getJob();
        StageType stage = call.getStage();
        int attempt = call.getAttempt();
        String message = describe(outcome.getError());
        ErrorClassification classification = retryPolicy.classify(outcome.getError());

        job.setInFlightStage(null);
        job.getStageAttempts().put(stage, attempt);
        job.setUpdatedAt(LocalDateTime.now());

        if (classification == ErrorClassification.RETRYABLE && attempt < retryPolicy.maxAttempts(stage)) {
            Duration delay = retryPolicy.nextDelay(stage, attempt);
            job.setLastError(message);
            jobStore.savePipelineJob(job);
            audit(call, outcome, StageOutcome.RETRYABLE_FAILURE, message);
            broadcaster.publish(jobEvent(ProgressEventType.STAGE_FAILED, job)
                    .stage(stage).attempt(attempt).willRetry(true).retryDelayMs(delay.toMillis())
                    .errorKind(failureKindOf(stage)).message(message).build());
            log.warn("[Scheduler] Job {} {} failed (attempt {}), retry in {}ms: {}",
                    job.getJobId(), stage, attempt, delay.toMillis(), message);
            scheduleRetry(active, stage.name(), delay, () -> enqueuePipelineStage(active, stage));
            return;
        }

        audit(call, outcome, auditOutcomeOf(classification), message);
        String reason = classification == ErrorClassification.RETRYABLE
                ? "Retries exhausted after " + attempt + " attempts: " + message
                : message;
        broadcaster.publish(jobEvent(ProgressEventType.STAGE_FAILED, job)
                .stage(stage).attempt(attempt).willRetry(false)
                .errorKind(failureKindOf(stage)).message(reason).build());
        failPipeline(active, failureKindOf(stage), reason);
    }

    private void failPipeline(ActiveJob active, FailureKind kind, String reason) {
        PipelineJob job = active.getJob();
        transition(job, PipelineStatus.FAILED);
        job.setLastError(truncate(kind.getUserGuidance() + " (" + reason + ")"));
        job.setLastErrorKind(kind);
        jobStore.savePipelineJob(job);

        active.clearPending();
        active.inFlightCalls().forEach(callRunner::cancel);

        broadcaster.publish(jobEvent(ProgressEventType.JOB_FAILED, job)
                .errorKind(kind)
                .message(job.getLastError())
                .build());
        log.error("[Scheduler] Job {} failed [{}]: {}", job.getJobId(), kind, reason);
    }

    // ========== 대기열 ==========

    private void enqueueScene(ActiveJob active, SceneJob scene) {
        StageType stage = scene.getCurrentStage().getStageType();
        if (stage == null || !active.markQueued(scene.getSceneJobId())) {
            return;
        }
        lanes.get(stage).enqueue(new DispatchTicket(active.getJobId(), scene.getSceneJobId(), stage,
                orderOf(active.getJob()), ticketSequence.incrementAndGet()));
        signal();
    }

    private void enqueuePipelineStage(ActiveJob active, StageType stage) {
        if (!active.markQueued(stage.name())) {
            return;
        }
        lanes.get(stage).enqueue(new DispatchTicket(active.getJobId(), null, stage,
                orderOf(active.getJob()), ticketSequence.incrementAndGet()));
        signal();
    }

    private void scheduleRetry(ActiveJob active, String key, Duration delay, Runnable enqueue) {
        if (delay.isZero() || delay.isNegative()) {
            enqueue.run();
            return;
        }
        try {
            active.putPendingRetry(key, timer.schedule(() -> {
                active.lock();
                try {
                    active.removePendingRetry(key);
                    if (running && !active.getJob().getStatus().isSettled()) {
                        enqueue.run();
                    }
                } finally {
                    active.unlock();
                }
            }, delay.toMillis(), TimeUnit.MILLISECONDS));
        } catch (RejectedExecutionException e) {
            log.warn("[Scheduler] Retry timer rejected {}; enqueueing immediately", key);
            enqueue.run();
        }
    }

    private void scheduleWakeup(long delayMs) {
        try {
            timer.schedule(this::signal, delayMs, TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            log.debug("[Scheduler] Wakeup timer rejected");
        }
    }

    private void signal() {
        wakeup.release();
    }

    // ========== 복구/활성화 ==========

    private boolean recoverJob(String jobId) {
        if (activeJobs.containsKey(jobId)) {
            return false;
        }
        JobSnapshot snapshot = jobStore.load(jobId).orElse(null);
        if (snapshot == null || snapshot.pipelineJob().getStatus().isSettled()) {
            return false;
        }

        ActiveJob active = ActiveJob.from(snapshot);
        if (activeJobs.putIfAbsent(jobId, active) != null) {
            return false;
        }

        active.lock();
        try {
            PipelineJob job = active.getJob();
            for (SceneJob scene : active.scenes()) {
                if (scene.getInFlightStage() != null) {
                    StageType interrupted = scene.getInFlightStage();
                    LocalDateTime startedAt = scene.getUpdatedAt();
                    scene.setInFlightStage(null);
                    scene.setUpdatedAt(LocalDateTime.now());
                    jobStore.saveSceneJob(scene);
                    jobStore.appendAuditRecord(StageCallRecord.builder()
                            .pipelineJobId(jobId)
                            .sceneJobId(scene.getSceneJobId())
                            .stage(interrupted)
                            .attempt(scene.attemptsOf(interrupted) + 1)
                            .outcome(StageOutcome.ABANDONED)
                            .startedAt(startedAt)
                            .endedAt(LocalDateTime.now())
                            .costDelta(BigDecimal.ZERO)
                            .errorMessage("Interrupted by restart")
                            .build());
                }
            }

            if (job.getInFlightStage() != null) {
                StageType interrupted = job.getInFlightStage();
                LocalDateTime startedAt = job.getUpdatedAt();
                job.setInFlightStage(null);
                job.setUpdatedAt(LocalDateTime.now());
                jobStore.savePipelineJob(job);
                jobStore.appendAuditRecord(StageCallRecord.builder()
                        .pipelineJobId(jobId)
                        .stage(interrupted)
                        .attempt(job.attemptsOf(interrupted) + 1)
                        .outcome(StageOutcome.ABANDONED)
                        .startedAt(startedAt)
                        .endedAt(LocalDateTime.now())
                        .costDelta(BigDecimal.ZERO)
                        .errorMessage("Interrupted by restart")
                        .build());
            }

            switch (job.getStatus()) {
                case QUEUED, RUNNING -> {
                    active.scenes().stream()
                            .filter(scene -> !scene.isTerminal())
                            .forEach(scene -> enqueueScene(active, scene));
                    checkReadiness(active);
                }
                case ASSEMBLING -> enqueuePipelineStage(active, StageType.ASSEMBLY);
                case UPLOADING -> enqueuePipelineStage(active, StageType.UPLOAD);
                default -> {
                }
            }
            log.info("[Scheduler] Recovered job {} in {} ({} scene(s))",
                    jobId, job.getStatus(), active.scenes().size());
            return true;
        } finally {
            releaseIfIdle(active);
            active.unlock();
        }
    }

    /**
     * 메모리에 없는 작업(종료 후 재시도/취소)을 저장소에서 불러와 활성화
     */
    private ActiveJob activate(String jobId) {
        ActiveJob active = activeJobs.get(jobId);
        if (active != null) {
            return active;
        }
        JobSnapshot snapshot = jobStore.load(jobId)
                .orElseThrow(() -> new ApiException(ErrorCode.PIPELINE_NOT_FOUND));
        ActiveJob loaded = ActiveJob.from(snapshot);
        ActiveJob existing = activeJobs.putIfAbsent(jobId, loaded);
        return existing != null ? existing : loaded;
    }

    private void releaseIfIdle(ActiveJob active) {
        if (active.getJob().getStatus().isSettled() && !active.hasInFlight()) {
            activeJobs.remove(active.getJobId(), active);
        }
    }

    private void ensureRunning() {
        if (!running) {
            throw new ApiException(ErrorCode.SCHEDULER_UNAVAILABLE);
        }
    }

    // ========== 헬퍼 ==========

    private void transition(PipelineJob job, PipelineStatus next) {
        PipelineStatus current = job.getStatus();
        if (!current.canTransitionTo(next)) {
            throw new IllegalStateException("Illegal pipeline transition " + current + " → " + next
                    + " (job " + job.getJobId() + ")");
        }
        job.setStatus(next);
        job.setUpdatedAt(LocalDateTime.now());
    }

    private boolean reopenIfFailed(PipelineJob job, PipelineStatus next) {
        if (job.getStatus() != PipelineStatus.FAILED) {
            return false;
        }
        transition(job, next);
        job.setLastError(null);
        job.setLastErrorKind(null);
        return true;
    }

    private void resetScene(SceneJob scene, Map<String, String> inputOverrides) {
        StageType failedStage = scene.getFailedStage() != null ? scene.getFailedStage() : StageType.SCRIPT;
        scene.setCurrentStage(SceneStage.of(failedStage));
        scene.getAttempts().put(failedStage, 0);
        scene.getFallbackUsed().remove(failedStage);
        scene.setFailedStage(null);
        scene.setLastError(null);
        scene.setLastErrorKind(null);
        if (inputOverrides != null) {
            scene.getInputs().putAll(inputOverrides);
        }
        scene.setUpdatedAt(LocalDateTime.now());
    }

    private void audit(InFlightCall call, CallOutcome outcome, StageOutcome result, String errorMessage) {
        PollResult pollResult = outcome.getResult();
        jobStore.appendAuditRecord(StageCallRecord.builder()
                .pipelineJobId(call.getInput().getPipelineJobId())
                .sceneJobId(call.getSceneJobId())
                .stage(call.getStage())
                .attempt(call.getAttempt())
                .outcome(result)
                .startedAt(call.getStartedAt())
                .endedAt(outcome.getEndedAt())
                .providerLatencyMs(outcome.getLatencyMs())
                .costDelta(pollResult != null ? pollResult.getCostDelta() : BigDecimal.ZERO)
                .errorMessage(errorMessage != null ? truncate(errorMessage) : null)
                .build());
    }

    private ProgressEvent.ProgressEventBuilder jobEvent(ProgressEventType type, PipelineJob job) {
        return ProgressEvent.builder()
                .type(type)
                .pipelineJobId(job.getJobId())
                .pipelineStatus(job.getStatus());
    }

    private ProgressEvent.ProgressEventBuilder sceneEvent(ProgressEventType type, PipelineJob job, SceneJob scene,
                                                          StageType stage, int attempt) {
        return jobEvent(type, job)
                .sceneJobId(scene.getSceneJobId())
                .sceneIndex(scene.getSceneIndex())
                .stage(stage)
                .attempt(attempt);
    }

    private static long orderOf(PipelineJob job) {
        return job.getCreatedAt().atZone(ZoneId.systemDefault()).toInstant().toEpochMilli();
    }

    private static FailureKind failureKindOf(StageType stage) {
        return stage == StageType.ASSEMBLY ? FailureKind.ASSEMBLY_FAILED : FailureKind.UPLOAD_FAILED;
    }

    private static FailureKind kindOf(ErrorClassification classification) {
        return switch (classification) {
            case RETRYABLE -> FailureKind.INFRASTRUCTURE;
            case MODERATION_REJECTED -> FailureKind.MODERATION_REJECTED;
            case TERMINAL -> FailureKind.TERMINAL;
        };
    }

    private static StageOutcome auditOutcomeOf(ErrorClassification classification) {
        return switch (classification) {
            case RETRYABLE -> StageOutcome.RETRYABLE_FAILURE;
            case MODERATION_REJECTED -> StageOutcome.MODERATION_REJECTED;
            case TERMINAL -> StageOutcome.TERMINAL_FAILURE;
        };
    }

    private static String describe(Throwable error) {
        if (error == null) {
            return "unknown error";
        }
        String message = error.getMessage();
        return message != null && !message.isBlank() ? message : error.getClass().getSimpleName();
    }

    private static String truncate(String text) {
        return text.length() > MAX_ERROR_LENGTH ? text.substring(0, MAX_ERROR_LENGTH) : text;
    }
}
