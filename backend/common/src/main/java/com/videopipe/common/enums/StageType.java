package com.videopipe.common.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * 외부 생성 호출 단계 종류.
 * 씬 단위 단계(SCRIPT ~ VIDEO_CLIP)와 파이프라인 단위 단계(ASSEMBLY, UPLOAD)로 나뉜다.
 */
@Getter
@RequiredArgsConstructor
public enum StageType {

    SCRIPT("스크립트 분석", true),
    VOICE("나레이션 음성 생성", true),
    VISUAL("이미지 생성", true),
    VIDEO_CLIP("씬 영상 생성", true),
    ASSEMBLY("영상 합성", false),
    UPLOAD("업로드", false);

    private final String description;
    private final boolean sceneLevel;
}
