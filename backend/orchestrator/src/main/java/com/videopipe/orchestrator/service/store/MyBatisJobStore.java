package com.videopipe.orchestrator.service.store;

import com.videopipe.common.enums.PipelineStatus;
import com.videopipe.orchestrator.entity.PipelineJob;
import com.videopipe.orchestrator.entity.SceneJob;
import com.videopipe.orchestrator.entity.StageCallRecord;
import com.videopipe.orchestrator.mapper.PipelineJobMapper;
import com.videopipe.orchestrator.mapper.SceneJobMapper;
import com.videopipe.orchestrator.mapper.StageCallRecordMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

/**
 * MyBatis 기반 JobStore.
 * 상태 전이마다 독립 트랜잭션(REQUIRES_NEW)으로 즉시 커밋한다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "pipeline.store.type", havingValue = "mybatis", matchIfMissing = true)
public class MyBatisJobStore implements JobStore {

    private static final List<PipelineStatus> RECOVERABLE_STATUSES = List.of(
            PipelineStatus.QUEUED, PipelineStatus.RUNNING, PipelineStatus.ASSEMBLING, PipelineStatus.UPLOADING);

    private final PipelineJobMapper pipelineJobMapper;
    private final SceneJobMapper sceneJobMapper;
    private final StageCallRecordMapper stageCallRecordMapper;

    @Override
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void save(PipelineJob pipelineJob, List<SceneJob> sceneJobs) {
        upsertPipelineJob(pipelineJob);
        for (SceneJob sceneJob : sceneJobs) {
            upsertSceneJob(sceneJob);
        }
        log.debug("[JobStore] jobId={} saved with {} scenes (committed)", pipelineJob.getJobId(), sceneJobs.size());
    }

    @Override
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void savePipelineJob(PipelineJob pipelineJob) {
        upsertPipelineJob(pipelineJob);
        log.debug("[JobStore] jobId={} status={} (committed)", pipelineJob.getJobId(), pipelineJob.getStatus());
    }

    @Override
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void saveSceneJob(SceneJob sceneJob) {
        upsertSceneJob(sceneJob);
        log.debug("[JobStore] sceneJobId={} stage={} (committed)", sceneJob.getSceneJobId(), sceneJob.getCurrentStage());
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<JobSnapshot> load(String jobId) {
        return pipelineJobMapper.findById(jobId)
                .map(job -> new JobSnapshot(job, sceneJobMapper.findByPipelineJobIdOrderByIndex(jobId)));
    }

    @Override
    public Optional<SceneJob> findSceneJob(String sceneJobId) {
        return sceneJobMapper.findById(sceneJobId);
    }

    @Override
    public Optional<String> findJobIdByIdempotencyKey(String idempotencyKey) {
        return pipelineJobMapper.findIdByIdempotencyKey(idempotencyKey);
    }

    @Override
    public List<String> findRecoverableJobIds() {
        return pipelineJobMapper.findIdsByStatuses(RECOVERABLE_STATUSES);
    }

    @Override
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void appendAuditRecord(StageCallRecord record) {
        stageCallRecordMapper.insert(record);
    }

    @Override
    public List<StageCallRecord> findAuditRecords(String pipelineJobId) {
        return stageCallRecordMapper.findByPipelineJobId(pipelineJobId);
    }

    private void upsertPipelineJob(PipelineJob pipelineJob) {
        if (pipelineJobMapper.update(pipelineJob) == 0) {
            pipelineJobMapper.insert(pipelineJob);
        }
    }

    private void upsertSceneJob(SceneJob sceneJob) {
        if (sceneJobMapper.update(sceneJob) == 0) {
            sceneJobMapper.insert(sceneJob);
        }
    }
}
