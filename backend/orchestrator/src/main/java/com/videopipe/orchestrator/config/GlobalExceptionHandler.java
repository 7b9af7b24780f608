package com.videopipe.orchestrator.config;

import com.videopipe.common.dto.ApiResponse;
import com.videopipe.common.exception.ApiException;
import com.videopipe.common.exception.ErrorCode;
import com.videopipe.orchestrator.service.error.ModerationRejectedException;
import com.videopipe.orchestrator.service.error.StageTimeoutException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.WebRequest;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.UUID;

/**
 * 전역 예외 처리기
 * - 컨트롤 API 예외를 ApiResponse 형식으로 변환
 * - 요청 ID 를 붙여 로그와 응답을 연결
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    /**
     * ApiException 처리 - 비즈니스 로직 예외
     */
    @ExceptionHandler(ApiException.class)
    public ResponseEntity<ApiResponse<Void>> handleApiException(ApiException e, WebRequest request) {
        String requestId = generateRequestId();
        ErrorCode errorCode = e.getErrorCode();

        // 4xx 는 호출자 오류라 한 줄로 충분
        if (errorCode.getStatus().is4xxClientError()) {
            log.warn("[API] {} ({}) {} - {} [{}]", errorCode.getCode(), errorCode.name(),
                    request.getDescription(false), e.getMessage(), requestId);
        } else {
            log.error("=== API Exception ===");
            log.error("Request ID: {}", requestId);
            log.error("Timestamp: {}", LocalDateTime.now().format(TIMESTAMP_FORMAT));
            log.error("Error Code: {} ({})", errorCode.getCode(), errorCode.name());
            log.error("Message: {}", e.getMessage());
            log.error("Request URI: {}", request.getDescription(false));
            log.error("Stack Trace: ", e);
            log.error("=====================");
        }

        return ResponseEntity
                .status(errorCode.getStatus())
                .body(ApiResponse.error(errorCode, buildUserMessage(errorCode, e.getMessage(), requestId)));
    }

    /**
     * 요청 본문 파싱 실패
     */
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiResponse<Void>> handleUnreadable(HttpMessageNotReadableException e, WebRequest request) {
        String requestId = generateRequestId();
        log.warn("[API] Unreadable request body {} - {} [{}]",
                request.getDescription(false), e.getMostSpecificCause().getMessage(), requestId);
        return ResponseEntity
                .status(ErrorCode.INVALID_REQUEST.getStatus())
                .body(ApiResponse.error(ErrorCode.INVALID_REQUEST,
                        buildUserMessage(ErrorCode.INVALID_REQUEST, "요청 본문을 읽을 수 없습니다.", requestId)));
    }

    /**
     * RuntimeException 처리 - 단계 오류가 컨트롤 API 까지 올라온 경우 포함
     */
    @ExceptionHandler(RuntimeException.class)
    public ResponseEntity<ApiResponse<Void>> handleRuntimeException(RuntimeException e, WebRequest request) {
        String requestId = generateRequestId();

        log.error("=== Runtime Exception ===");
        log.error("Request ID: {}", requestId);
        log.error("Timestamp: {}", LocalDateTime.now().format(TIMESTAMP_FORMAT));
        log.error("Exception Type: {}", e.getClass().getSimpleName());
        log.error("Message: {}", e.getMessage());
        log.error("Request URI: {}", request.getDescription(false));
        log.error("Stack Trace: ", e);
        log.error("=========================");

        ErrorCode errorCode = mapExceptionToErrorCode(e);
        return ResponseEntity
                .status(errorCode.getStatus())
                .body(ApiResponse.error(errorCode, String.format("%s [요청 ID: %s]", errorCode.getMessage(), requestId)));
    }

    /**
     * 일반 Exception 처리 - 예상치 못한 예외
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiResponse<Void>> handleException(Exception e, WebRequest request) {
        String requestId = generateRequestId();

        log.error("=== Unexpected Exception ===");
        log.error("Request ID: {}", requestId);
        log.error("Timestamp: {}", LocalDateTime.now().format(TIMESTAMP_FORMAT));
        log.error("Exception Type: {}", e.getClass().getName());
        log.error("Message: {}", e.getMessage());
        log.error("Request URI: {}", request.getDescription(false));
        log.error("Stack Trace: ", e);
        log.error("============================");

        String userMessage = String.format(
            "서버 오류가 발생했습니다. [요청 ID: %s] 문제가 지속되면 관리자에게 문의해주세요.",
            requestId
        );

        return ResponseEntity
                .status(ErrorCode.INTERNAL_SERVER_ERROR.getStatus())
                .body(ApiResponse.error(ErrorCode.INTERNAL_SERVER_ERROR, userMessage));
    }

    /**
     * 요청 ID 생성 (오류 추적용)
     */
    private String generateRequestId() {
        return UUID.randomUUID().toString().substring(0, 8).toUpperCase();
    }

    private String buildUserMessage(ErrorCode errorCode, String message, String requestId) {
        if (message != null && !message.equals(errorCode.getMessage())) {
            return String.format("%s [%s]", message, requestId);
        }
        return String.format("%s [%s]", errorCode.getMessage(), requestId);
    }

    private ErrorCode mapExceptionToErrorCode(RuntimeException e) {
        if (e instanceof ModerationRejectedException) {
            return ErrorCode.STAGE_MODERATION_REJECTED;
        }
        if (e instanceof StageTimeoutException) {
            return ErrorCode.STAGE_TIMEOUT;
        }
        if (e instanceof IllegalArgumentException) {
            return ErrorCode.INVALID_REQUEST;
        }
        return ErrorCode.INTERNAL_SERVER_ERROR;
    }
}
