package com.videopipe.common.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * 파이프라인 작업 상태
 */
@Getter
@RequiredArgsConstructor
public enum PipelineStatus {

    QUEUED("대기중"),
    RUNNING("씬 생성중"),
    ASSEMBLING("영상 합성중"),
    UPLOADING("업로드중"),
    COMPLETED("완료"),
    FAILED("실패"),
    CANCELLED("취소됨");

    private final String description;

    /**
     * FAILED 는 명시적 재시도로만 다시 열린다.
     */
    public boolean canTransitionTo(PipelineStatus next) {
        return switch (this) {
            case QUEUED -> next == RUNNING || next == FAILED || next == CANCELLED;
            case RUNNING -> next == ASSEMBLING || next == FAILED || next == CANCELLED;
            case ASSEMBLING -> next == UPLOADING || next == FAILED || next == CANCELLED;
            case UPLOADING -> next == COMPLETED || next == FAILED || next == CANCELLED;
            case FAILED -> next == RUNNING || next == ASSEMBLING || next == UPLOADING || next == CANCELLED;
            case COMPLETED, CANCELLED -> false;
        };
    }

    /** 더 이상 스케줄러가 진행시키지 않는 상태 */
    public boolean isSettled() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }

    public boolean isFinal() {
        return this == COMPLETED || this == CANCELLED;
    }
}
