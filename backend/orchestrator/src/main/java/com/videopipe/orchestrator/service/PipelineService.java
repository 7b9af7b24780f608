package com.videopipe.orchestrator.service;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.videopipe.common.exception.ApiException;
import com.videopipe.common.exception.ErrorCode;
import com.videopipe.orchestrator.dto.PipelineDto;
import com.videopipe.orchestrator.entity.PipelineJob;
import com.videopipe.orchestrator.entity.SceneJob;
import com.videopipe.orchestrator.entity.StageCallRecord;
import com.videopipe.orchestrator.service.retry.StagePacingService;
import com.videopipe.orchestrator.service.scheduler.PipelineScheduler;
import com.videopipe.orchestrator.service.scheduler.PipelineSubmission;
import com.videopipe.orchestrator.service.script.ParsedScript;
import com.videopipe.orchestrator.service.script.ScriptParser;
import com.videopipe.orchestrator.service.script.ScriptResolver;
import com.videopipe.orchestrator.service.store.JobSnapshot;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * 컨트롤 API 서비스
 * 스크립트 해석 → 씬 분해 → 스케줄러 제출, 상태/감사 기록 조회를 DTO 로 변환한다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PipelineService {

    private static final String INLINE_SCRIPT_REF = "inline";

    private final PipelineScheduler scheduler;
    private final ScriptResolver scriptResolver;
    private final ScriptParser scriptParser;
    private final StagePacingService pacingService;

    // 완료/취소된 작업 상태 캐시 (더 이상 바뀌지 않음)
    private Cache<String, PipelineDto.StatusResponse> finishedStatusCache;

    @PostConstruct
    public void initCache() {
        this.finishedStatusCache = Caffeine.newBuilder()
            .expireAfterWrite(10, TimeUnit.MINUTES)
            .maximumSize(1000)
            .build();
        log.info("[Pipeline] Finished-status cache initialized (TTL: 10m)");
    }

    // ========== 제출 ==========

    public PipelineDto.SubmitResponse submit(PipelineDto.SubmitRequest request) {
        if (request == null) {
            throw new ApiException(ErrorCode.INVALID_REQUEST);
        }

        boolean inline = request.getScriptContent() != null && !request.getScriptContent().isBlank();
        String scriptRef = inline && (request.getScriptRef() == null || request.getScriptRef().isBlank())
                ? INLINE_SCRIPT_REF
                : request.getScriptRef();
        String content = inline ? request.getScriptContent() : scriptResolver.resolve(scriptRef);

        ParsedScript script = scriptParser.parse(content);
        if (script.scenes().isEmpty()) {
            throw new ApiException(ErrorCode.SCRIPT_EMPTY);
        }

        PipelineSubmission.PipelineSubmissionBuilder submission = PipelineSubmission.builder()
                .scriptRef(scriptRef)
                .scriptTitle(script.title().isBlank() ? null : script.title())
                .idempotencyKey(request.getIdempotencyKey())
                .allowPartialAssembly(request.getAllowPartialAssembly())
                .costBudget(request.getCostBudget());
        script.scenes().forEach(scene -> submission.sceneText(scene.text()));

        String jobId = scheduler.submit(submission.build());
        JobSnapshot snapshot = scheduler.getStatus(jobId);

        log.info("[Pipeline] Submitted '{}' ({}) → job {}, {} scenes",
                script.title(), scriptRef, jobId, snapshot.sceneJobs().size());
        return PipelineDto.SubmitResponse.builder()
                .jobId(jobId)
                .status(snapshot.pipelineJob().getStatus())
                .sceneCount(snapshot.sceneJobs().size())
                .build();
    }

    // ========== 조회 ==========

    public PipelineDto.StatusResponse getStatus(String jobId) {
        PipelineDto.StatusResponse cached = finishedStatusCache.getIfPresent(jobId);
        if (cached != null) {
            return cached;
        }

        PipelineDto.StatusResponse response = toStatusResponse(scheduler.getStatus(jobId));
        if (response.getStatus().isFinal()) {
            finishedStatusCache.put(jobId, response);
        }
        return response;
    }

    public List<PipelineDto.AuditRecord> getAuditTrail(String jobId) {
        return scheduler.getAuditTrail(jobId).stream()
                .map(this::toAuditRecord)
                .toList();
    }

    public List<PipelineDto.LaneStatus> getLaneStatus() {
        return scheduler.getLaneStats().entrySet().stream()
                .map(entry -> PipelineDto.LaneStatus.builder()
                        .stage(entry.getKey())
                        .queued(entry.getValue().queued())
                        .inFlight(entry.getValue().inFlight())
                        .limit(entry.getValue().limit())
                        .pacingDelayMs(pacingService.currentDelayMs(entry.getKey()))
                        .build())
                .toList();
    }

    // ========== 제어 ==========

    public PipelineDto.StatusResponse cancel(String jobId) {
        PipelineDto.StatusResponse response = toStatusResponse(scheduler.cancel(jobId));
        finishedStatusCache.invalidate(jobId);
        return response;
    }

    public PipelineDto.StatusResponse retryPipeline(String jobId) {
        finishedStatusCache.invalidate(jobId);
        return toStatusResponse(scheduler.retryPipeline(jobId));
    }

    public PipelineDto.StatusResponse retryScene(String sceneJobId, Map<String, String> inputOverrides) {
        JobSnapshot snapshot = scheduler.retryFailedScene(sceneJobId, inputOverrides);
        finishedStatusCache.invalidate(snapshot.pipelineJob().getJobId());
        return toStatusResponse(snapshot);
    }

    // ========== 변환 ==========

    private PipelineDto.StatusResponse toStatusResponse(JobSnapshot snapshot) {
        PipelineJob job = snapshot.pipelineJob();
        List<PipelineDto.SceneStatus> scenes = snapshot.sceneJobs().stream()
                .sorted(Comparator.comparing(SceneJob::getSceneIndex))
                .map(this::toSceneStatus)
                .toList();

        return PipelineDto.StatusResponse.builder()
                .jobId(job.getJobId())
                .scriptRef(job.getScriptRef())
                .scriptTitle(job.getScriptTitle())
                .status(job.getStatus())
                .statusDescription(job.getStatus().getDescription())
                .allowPartialAssembly(job.isAllowPartialAssembly())
                .costAccumulated(job.getCostAccumulated())
                .costBudget(job.getCostBudget())
                .stageAttempts(job.getStageAttempts())
                .stageAssets(job.getStageAssets())
                .finalAssetRef(job.getFinalAssetRef())
                .lastError(job.getLastError())
                .lastErrorKind(job.getLastErrorKind())
                .readySceneCount((int) snapshot.sceneJobs().stream().filter(SceneJob::isReady).count())
                .failedSceneCount((int) snapshot.sceneJobs().stream().filter(SceneJob::isFailed).count())
                .scenes(scenes)
                .createdAt(job.getCreatedAt())
                .updatedAt(job.getUpdatedAt())
                .completedAt(job.getCompletedAt())
                .build();
    }

    private PipelineDto.SceneStatus toSceneStatus(SceneJob scene) {
        return PipelineDto.SceneStatus.builder()
                .sceneJobId(scene.getSceneJobId())
                .sceneIndex(scene.getSceneIndex())
                .currentStage(scene.getCurrentStage())
                .inFlightStage(scene.getInFlightStage())
                .failedStage(scene.getFailedStage())
                .attempts(scene.getAttempts())
                .fallbackUsed(scene.getFallbackUsed())
                .assets(scene.getAssets())
                .lastError(scene.getLastError())
                .lastErrorKind(scene.getLastErrorKind())
                .updatedAt(scene.getUpdatedAt())
                .build();
    }

    private PipelineDto.AuditRecord toAuditRecord(StageCallRecord record) {
        return PipelineDto.AuditRecord.builder()
                .recordId(record.getRecordId())
                .sceneJobId(record.getSceneJobId())
                .stage(record.getStage())
                .attempt(record.getAttempt())
                .outcome(record.getOutcome())
                .startedAt(record.getStartedAt())
                .endedAt(record.getEndedAt())
                .providerLatencyMs(record.getProviderLatencyMs())
                .costDelta(record.getCostDelta())
                .errorMessage(record.getErrorMessage())
                .build();
    }
}
