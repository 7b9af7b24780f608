package com.videopipe.orchestrator.service.progress;

public enum ProgressEventType {
    STAGE_STARTED,
    STAGE_PROGRESS,
    STAGE_COMPLETED,
    STAGE_FAILED,
    JOB_STATUS_CHANGED,
    JOB_COMPLETED,
    JOB_FAILED,
    JOB_CANCELLED,
    /** 구독자 큐가 넘쳐 이벤트가 누락되었음을 알리는 표식 */
    PROGRESS_GAP
}
