package com.videopipe.common.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;

@Getter
@RequiredArgsConstructor
public enum ErrorCode {

    // Common
    INTERNAL_SERVER_ERROR(HttpStatus.INTERNAL_SERVER_ERROR, "C001", "서버 내부 오류가 발생했습니다."),
    INVALID_REQUEST(HttpStatus.BAD_REQUEST, "C002", "잘못된 요청입니다."),
    NOT_FOUND(HttpStatus.NOT_FOUND, "C005", "리소스를 찾을 수 없습니다."),

    // Script
    SCRIPT_NOT_FOUND(HttpStatus.NOT_FOUND, "S001", "스크립트를 찾을 수 없습니다."),
    SCRIPT_EMPTY(HttpStatus.BAD_REQUEST, "S002", "스크립트에 씬이 없습니다. 최소 한 개의 씬이 필요합니다."),
    SCRIPT_INVALID(HttpStatus.BAD_REQUEST, "S003", "스크립트 형식이 올바르지 않습니다."),
    SCRIPT_PATH_DENIED(HttpStatus.FORBIDDEN, "S004", "허용되지 않은 스크립트 경로입니다."),

    // Pipeline
    PIPELINE_NOT_FOUND(HttpStatus.NOT_FOUND, "P001", "파이프라인 작업을 찾을 수 없습니다."),
    SCENE_JOB_NOT_FOUND(HttpStatus.NOT_FOUND, "P002", "씬 작업을 찾을 수 없습니다."),
    PIPELINE_ALREADY_FINISHED(HttpStatus.CONFLICT, "P003", "이미 종료된 파이프라인입니다."),
    PIPELINE_NOT_RETRYABLE(HttpStatus.CONFLICT, "P004", "현재 상태에서는 파이프라인을 재시도할 수 없습니다."),
    SCENE_NOT_RETRYABLE(HttpStatus.CONFLICT, "P005", "현재 상태에서는 씬을 재시도할 수 없습니다."),
    SCHEDULER_UNAVAILABLE(HttpStatus.SERVICE_UNAVAILABLE, "P006", "스케줄러가 실행 중이 아닙니다. 잠시 후 다시 시도해주세요."),

    // Stage
    STAGE_ADAPTER_MISSING(HttpStatus.INTERNAL_SERVER_ERROR, "G001", "해당 단계를 처리할 어댑터가 등록되지 않았습니다."),
    STAGE_MODERATION_REJECTED(HttpStatus.BAD_REQUEST, "G002", "콘텐츠 안전 정책에 의해 요청이 거부되었습니다."),
    STAGE_TIMEOUT(HttpStatus.GATEWAY_TIMEOUT, "G003", "외부 생성 서비스 응답 시간이 초과되었습니다.");

    private final HttpStatus status;
    private final String code;
    private final String message;
}
