package com.videopipe.common.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * 실패 종류와 사용자 안내 문구
 */
@Getter
@RequiredArgsConstructor
public enum FailureKind {

    INVALID_INPUT("입력값이 올바르지 않습니다. 스크립트를 확인해주세요."),
    INFRASTRUCTURE("외부 생성 서비스가 일시적으로 불안정합니다. 잠시 후 다시 시도해주세요."),
    TERMINAL("생성 요청이 거부되었습니다. 입력과 설정을 확인한 뒤 다시 시도해주세요."),
    MODERATION_REJECTED("콘텐츠 안전 정책에 의해 거부되었습니다. 씬 설명을 다른 표현으로 바꿔주세요."),
    ASSEMBLY_FAILED("영상 합성에 실패했습니다. 잠시 후 파이프라인을 다시 시도해주세요."),
    UPLOAD_FAILED("업로드에 실패했습니다. 잠시 후 파이프라인을 다시 시도해주세요."),
    SCENE_FAILED("일부 씬 생성에 실패했습니다. 실패한 씬을 다시 시도해주세요."),
    BUDGET_EXCEEDED("비용 한도를 초과하여 작업이 중단되었습니다.");

    private final String userGuidance;
}
