package com.videopipe.orchestrator.service.moderation;

import com.videopipe.common.enums.StageType;
import com.videopipe.orchestrator.service.error.ModerationRejectedException;

import java.util.Map;

/**
 * 안전 필터에 거부된 단계 입력을 대체 입력으로 바꾼다.
 * 스케줄러는 단계당 한 번만 호출하고, 결과로 딱 한 번 더 시도한다.
 */
public interface ModerationFallback {

    /**
     * @param stage     거부된 단계
     * @param inputs    거부 당시 씬 입력
     * @param rejection 거부 상세
     * @return 새 입력 (원본은 변경하지 않음)
     */
    Map<String, String> rewrite(StageType stage, Map<String, String> inputs, ModerationRejectedException rejection);
}
