package com.videopipe.orchestrator.service.store;

import com.videopipe.orchestrator.entity.PipelineJob;
import com.videopipe.orchestrator.entity.SceneJob;
import com.videopipe.orchestrator.entity.StageCallRecord;

import java.util.List;
import java.util.Optional;

/**
 * 파이프라인 상태의 단일 영속 저장소.
 * 스케줄러는 상태 전이를 여기에 먼저 기록한 뒤 진행 이벤트를 발행한다.
 */
public interface JobStore {

    /**
     * 파이프라인 작업과 씬 작업을 한 번에 저장 (신규면 삽입, 있으면 갱신)
     */
    void save(PipelineJob pipelineJob, List<SceneJob> sceneJobs);

    void savePipelineJob(PipelineJob pipelineJob);

    void saveSceneJob(SceneJob sceneJob);

    Optional<JobSnapshot> load(String jobId);

    Optional<SceneJob> findSceneJob(String sceneJobId);

    Optional<String> findJobIdByIdempotencyKey(String idempotencyKey);

    /**
     * 재시작 시 이어서 진행할 작업 ID (QUEUED, RUNNING, ASSEMBLING, UPLOADING), 생성 순
     */
    List<String> findRecoverableJobIds();

    void appendAuditRecord(StageCallRecord record);

    List<StageCallRecord> findAuditRecords(String pipelineJobId);
}
