package com.videopipe.orchestrator.service.scheduler;

import com.videopipe.orchestrator.entity.PipelineJob;
import com.videopipe.orchestrator.entity.SceneJob;
import com.videopipe.orchestrator.service.store.JobSnapshot;
import lombok.Getter;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 스케줄러가 진행 중인 파이프라인 작업의 작업용 사본.
 * 모든 접근은 lock 안에서 이뤄진다 (작업 단위 단일 writer).
 */
class ActiveJob {

    @Getter
    private final PipelineJob job;
    private final Map<String, SceneJob> scenes = new LinkedHashMap<>();
    private final Map<String, InFlightCall> inFlight = new HashMap<>();
    private final Map<String, ScheduledFuture<?>> pendingRetries = new HashMap<>();
    private final Set<String> queued = new HashSet<>();
    private final ReentrantLock lock = new ReentrantLock();

    ActiveJob(PipelineJob job, List<SceneJob> sceneJobs) {
        this.job = job;
        sceneJobs.forEach(scene -> scenes.put(scene.getSceneJobId(), scene));
    }

    static ActiveJob from(JobSnapshot snapshot) {
        return new ActiveJob(snapshot.pipelineJob().copy(),
                snapshot.sceneJobs().stream().map(SceneJob::copy).toList());
    }

    String getJobId() {
        return job.getJobId();
    }

    void lock() {
        lock.lock();
    }

    void unlock() {
        lock.unlock();
    }

    SceneJob scene(String sceneJobId) {
        return scenes.get(sceneJobId);
    }

    Collection<SceneJob> scenes() {
        return scenes.values();
    }

    boolean markQueued(String key) {
        return queued.add(key);
    }

    void unmarkQueued(String key) {
        queued.remove(key);
    }

    boolean isInFlight(String key) {
        return inFlight.containsKey(key);
    }

    void putInFlight(InFlightCall call) {
        inFlight.put(call.getKey(), call);
    }

    void removeInFlight(InFlightCall call) {
        inFlight.remove(call.getKey(), call);
    }

    List<InFlightCall> inFlightCalls() {
        return new ArrayList<>(inFlight.values());
    }

    boolean hasInFlight() {
        return !inFlight.isEmpty();
    }

    void putPendingRetry(String key, ScheduledFuture<?> future) {
        pendingRetries.put(key, future);
    }

    void removePendingRetry(String key) {
        pendingRetries.remove(key);
    }

    /**
     * 대기 중인 재시도와 적재 표시 모두 제거
     */
    void clearPending() {
        pendingRetries.values().forEach(future -> future.cancel(false));
        pendingRetries.clear();
        queued.clear();
    }

    JobSnapshot snapshot() {
        return new JobSnapshot(job.copy(), scenes.values().stream().map(SceneJob::copy).toList());
    }
}
