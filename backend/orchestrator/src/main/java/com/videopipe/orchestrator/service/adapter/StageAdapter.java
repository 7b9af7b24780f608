package com.videopipe.orchestrator.service.adapter;

import com.videopipe.common.enums.StageType;
import com.videopipe.orchestrator.service.error.StageException;

/**
 * 외부 생성 기능(TTS, 이미지, 영상, 합성, 업로드)의 공통 계약.
 * 벤더 응답 형식은 구현체 안에서 PollResult 로 변환한다.
 */
public interface StageAdapter {

    StageType stage();

    /**
     * 외부 작업 제출. 빠르게 반환해야 하며 완료를 기다리지 않는다.
     *
     * @throws StageException 제출 자체가 거부된 경우
     */
    TaskHandle submit(StageInput input);

    /**
     * 작업 상태 조회. 실패는 예외 대신 {@link PollResult#failed} 로 돌려준다.
     */
    PollResult poll(TaskHandle handle);

    /**
     * 작업 취소 (best-effort)
     */
    void cancel(TaskHandle handle);
}
