package com.videopipe.orchestrator.service.scheduler;

import com.videopipe.common.enums.StageType;

import java.util.Comparator;

/**
 * 단계 대기열 항목. sceneJobId 가 null 이면 파이프라인 단위 단계.
 *
 * @param pipelineOrder 오래된 파이프라인 우선 (생성 시각 epoch millis)
 * @param sequence      같은 파이프라인 안에서는 적재 순서 (FIFO)
 */
record DispatchTicket(String pipelineJobId, String sceneJobId, StageType stage, long pipelineOrder, long sequence) {

    static final Comparator<DispatchTicket> ORDER = Comparator
            .comparingLong(DispatchTicket::pipelineOrder)
            .thenComparingLong(DispatchTicket::sequence);

    String key() {
        return keyOf(sceneJobId, stage);
    }

    boolean isSceneStage() {
        return sceneJobId != null;
    }

    static String keyOf(String sceneJobId, StageType stage) {
        return sceneJobId != null ? sceneJobId : stage.name();
    }
}
