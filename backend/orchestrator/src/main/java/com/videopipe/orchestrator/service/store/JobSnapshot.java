package com.videopipe.orchestrator.service.store;

import com.videopipe.orchestrator.entity.PipelineJob;
import com.videopipe.orchestrator.entity.SceneJob;

import java.util.List;

/**
 * 파이프라인 작업과 씬 작업들의 일관된 읽기 스냅샷 (sceneIndex 순)
 */
public record JobSnapshot(PipelineJob pipelineJob, List<SceneJob> sceneJobs) {

    public JobSnapshot {
        sceneJobs = List.copyOf(sceneJobs);
    }
}
