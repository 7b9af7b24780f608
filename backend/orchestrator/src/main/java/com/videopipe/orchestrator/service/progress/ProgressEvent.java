package com.videopipe.orchestrator.service.progress;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.videopipe.common.enums.FailureKind;
import com.videopipe.common.enums.PipelineStatus;
import com.videopipe.common.enums.StageType;
import lombok.Builder;
import lombok.Getter;

import java.time.LocalDateTime;

/**
 * 진행 상황 이벤트. sequence 는 브로드캐스터가 발행 순서대로 부여한다.
 */
@Getter
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ProgressEvent {
    private final long sequence;
    private final ProgressEventType type;
    private final String pipelineJobId;
    private final String sceneJobId;
    private final Integer sceneIndex;
    private final StageType stage;
    private final Integer attempt;
    private final Integer percent;
    private final PipelineStatus pipelineStatus;
    private final Boolean willRetry;
    private final Long retryDelayMs;
    private final FailureKind errorKind;
    private final String message;
    private final Long droppedCount;
    private final LocalDateTime occurredAt;

    public static ProgressEvent gap(String pipelineJobId, long droppedCount) {
        return ProgressEvent.builder()
                .type(ProgressEventType.PROGRESS_GAP)
                .pipelineJobId(pipelineJobId)
                .droppedCount(droppedCount)
                .message(droppedCount + " events dropped; reload status to resync")
                .occurredAt(LocalDateTime.now())
                .build();
    }
}
