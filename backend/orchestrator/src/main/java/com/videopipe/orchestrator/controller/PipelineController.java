package com.videopipe.orchestrator.controller;

import com.videopipe.common.dto.ApiResponse;
import com.videopipe.orchestrator.dto.PipelineDto;
import com.videopipe.orchestrator.service.PipelineService;
import com.videopipe.orchestrator.service.progress.ProgressStreamService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.List;

@Slf4j
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/pipelines")
@Tag(name = "Pipeline", description = "영상 생성 파이프라인 제어 API")
public class PipelineController {

    private final PipelineService pipelineService;
    private final ProgressStreamService progressStreamService;

    // ========== 제출/조회 ==========

    @PostMapping
    @Operation(summary = "파이프라인 제출", description = "스크립트를 씬 단위로 분해해 생성 파이프라인을 시작합니다.")
    public ApiResponse<PipelineDto.SubmitResponse> submit(@RequestBody PipelineDto.SubmitRequest request) {
        log.info("[Pipeline] Submit - scriptRef: {}, inline: {}, idempotencyKey: {}",
                request.getScriptRef(),
                request.getScriptContent() != null,
                request.getIdempotencyKey());
        return ApiResponse.success("파이프라인이 등록되었습니다.", pipelineService.submit(request));
    }

    @GetMapping("/{jobId}")
    @Operation(summary = "파이프라인 상태 조회", description = "작업과 씬별 진행 단계, 시도 횟수, 결과물을 조회합니다.")
    public ApiResponse<PipelineDto.StatusResponse> getStatus(@PathVariable String jobId) {
        return ApiResponse.success(pipelineService.getStatus(jobId));
    }

    @GetMapping("/{jobId}/audit")
    @Operation(summary = "단계 호출 기록 조회", description = "외부 단계 호출마다 남긴 감사 기록을 조회합니다.")
    public ApiResponse<List<PipelineDto.AuditRecord>> getAuditTrail(@PathVariable String jobId) {
        return ApiResponse.success(pipelineService.getAuditTrail(jobId));
    }

    @GetMapping("/lanes")
    @Operation(summary = "단계별 대기열 현황", description = "단계별 대기/진행 건수와 동시 실행 한도를 조회합니다.")
    public ApiResponse<List<PipelineDto.LaneStatus>> getLanes() {
        return ApiResponse.success(pipelineService.getLaneStatus());
    }

    // ========== 제어 ==========

    @PostMapping("/{jobId}/cancel")
    @Operation(summary = "파이프라인 취소", description = "새 단계 실행을 멈추고 진행 중인 호출을 취소합니다. 생성된 결과물은 유지됩니다.")
    public ApiResponse<PipelineDto.StatusResponse> cancel(@PathVariable String jobId) {
        log.info("[Pipeline] Cancel - jobId: {}", jobId);
        return ApiResponse.success("파이프라인이 취소되었습니다.", pipelineService.cancel(jobId));
    }

    @PostMapping("/{jobId}/retry")
    @Operation(summary = "파이프라인 재시도", description = "실패한 합성/업로드 또는 실패한 씬 전체를 다시 진행합니다.")
    public ApiResponse<PipelineDto.StatusResponse> retryPipeline(@PathVariable String jobId) {
        log.info("[Pipeline] Retry pipeline - jobId: {}", jobId);
        return ApiResponse.success("파이프라인 재시도를 시작했습니다.", pipelineService.retryPipeline(jobId));
    }

    @PostMapping("/scenes/{sceneJobId}/retry")
    @Operation(summary = "씬 재시도", description = "실패한 씬을 실패한 단계부터 다시 진행합니다. 입력을 바꿔서 재시도할 수 있습니다.")
    public ApiResponse<PipelineDto.StatusResponse> retryScene(
            @PathVariable String sceneJobId,
            @RequestBody(required = false) PipelineDto.SceneRetryRequest request) {
        log.info("[Pipeline] Retry scene - sceneJobId: {}, overrides: {}",
                sceneJobId, request != null && request.getInputOverrides() != null ? request.getInputOverrides().keySet() : "none");
        return ApiResponse.success(pipelineService.retryScene(sceneJobId,
                request != null ? request.getInputOverrides() : null));
    }

    // ========== 진행 이벤트 ==========

    @GetMapping(value = "/{jobId}/events", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    @Operation(summary = "진행 이벤트 스트림", description = "작업의 단계 시작/진행/완료/실패 이벤트를 SSE 로 구독합니다.")
    public SseEmitter streamEvents(@PathVariable String jobId) {
        pipelineService.getStatus(jobId);
        return progressStreamService.open(jobId);
    }

    @GetMapping(value = "/events", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    @Operation(summary = "전체 진행 이벤트 스트림", description = "모든 작업의 진행 이벤트를 SSE 로 구독합니다.")
    public SseEmitter streamAllEvents() {
        return progressStreamService.open(null);
    }
}
