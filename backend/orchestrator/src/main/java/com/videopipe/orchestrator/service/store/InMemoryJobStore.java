package com.videopipe.orchestrator.service.store;

import com.videopipe.orchestrator.entity.PipelineJob;
import com.videopipe.orchestrator.entity.SceneJob;
import com.videopipe.orchestrator.entity.StageCallRecord;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * 메모리 JobStore (로컬 실행/테스트용).
 * 저장과 조회 모두 복사본을 주고받아 호출자가 저장된 상태를 직접 바꾸지 못한다.
 */
@Component
@ConditionalOnProperty(name = "pipeline.store.type", havingValue = "memory")
public class InMemoryJobStore implements JobStore {

    private final Map<String, PipelineJob> pipelineJobs = new HashMap<>();
    private final Map<String, SceneJob> sceneJobs = new HashMap<>();
    private final Map<String, String> idempotencyKeys = new HashMap<>();
    private final Map<String, List<StageCallRecord>> auditRecords = new HashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    @Override
    public void save(PipelineJob pipelineJob, List<SceneJob> scenes) {
        lock.writeLock().lock();
        try {
            putPipelineJob(pipelineJob);
            for (SceneJob scene : scenes) {
                sceneJobs.put(scene.getSceneJobId(), scene.copy());
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public void savePipelineJob(PipelineJob pipelineJob) {
        lock.writeLock().lock();
        try {
            putPipelineJob(pipelineJob);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public void saveSceneJob(SceneJob sceneJob) {
        lock.writeLock().lock();
        try {
            sceneJobs.put(sceneJob.getSceneJobId(), sceneJob.copy());
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public Optional<JobSnapshot> load(String jobId) {
        lock.readLock().lock();
        try {
            PipelineJob job = pipelineJobs.get(jobId);
            if (job == null) {
                return Optional.empty();
            }
            List<SceneJob> scenes = sceneJobs.values().stream()
                    .filter(scene -> jobId.equals(scene.getPipelineJobId()))
                    .sorted(Comparator.comparing(SceneJob::getSceneIndex))
                    .map(SceneJob::copy)
                    .toList();
            return Optional.of(new JobSnapshot(job.copy(), scenes));
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public Optional<SceneJob> findSceneJob(String sceneJobId) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(sceneJobs.get(sceneJobId)).map(SceneJob::copy);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public Optional<String> findJobIdByIdempotencyKey(String idempotencyKey) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(idempotencyKeys.get(idempotencyKey));
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<String> findRecoverableJobIds() {
        lock.readLock().lock();
        try {
            return pipelineJobs.values().stream()
                    .filter(job -> !job.getStatus().isSettled())
                    .sorted(Comparator.comparing(PipelineJob::getCreatedAt))
                    .map(PipelineJob::getJobId)
                    .toList();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public void appendAuditRecord(StageCallRecord record) {
        lock.writeLock().lock();
        try {
            auditRecords.computeIfAbsent(record.getPipelineJobId(), id -> new ArrayList<>()).add(record);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public List<StageCallRecord> findAuditRecords(String pipelineJobId) {
        lock.readLock().lock();
        try {
            return List.copyOf(auditRecords.getOrDefault(pipelineJobId, List.of()));
        } finally {
            lock.readLock().unlock();
        }
    }

    private void putPipelineJob(PipelineJob pipelineJob) {
        pipelineJobs.put(pipelineJob.getJobId(), pipelineJob.copy());
        if (pipelineJob.getIdempotencyKey() != null) {
            idempotencyKeys.putIfAbsent(pipelineJob.getIdempotencyKey(), pipelineJob.getJobId());
        }
    }
}
