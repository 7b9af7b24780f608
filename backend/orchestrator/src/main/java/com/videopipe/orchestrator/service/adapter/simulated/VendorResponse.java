package com.videopipe.orchestrator.service.adapter.simulated;

import com.videopipe.orchestrator.service.adapter.PollResult;
import com.videopipe.orchestrator.service.error.ModerationRejectedException;
import com.videopipe.orchestrator.service.error.ModerationRejectedException.ModerationCategory;
import com.videopipe.orchestrator.service.error.RetryableStageException;
import com.videopipe.orchestrator.service.error.TerminalStageException;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

/**
 * 벤더 응답 변형. 어댑터 경계 밖으로는 PollResult 로만 나간다.
 */
public abstract class VendorResponse {

    public abstract PollResult toPollResult();

    @Getter
    @RequiredArgsConstructor
    public static final class Completed extends VendorResponse {
        private final String assetUri;
        private final BigDecimal cost;
        private final Map<String, String> outputs;

        @Override
        public PollResult toPollResult() {
            return PollResult.succeeded(assetUri, cost, outputs);
        }
    }

    @Getter
    @RequiredArgsConstructor
    public static final class Throttled extends VendorResponse {
        private final int retryAfterSeconds;

        @Override
        public PollResult toPollResult() {
            return PollResult.failed(new RetryableStageException(
                    "Vendor rate limit exceeded (retry after " + retryAfterSeconds + "s)", 429, true, null));
        }
    }

    @Getter
    @RequiredArgsConstructor
    public static final class ServiceUnavailable extends VendorResponse {
        private final int statusCode;

        @Override
        public PollResult toPollResult() {
            return PollResult.failed(new RetryableStageException(
                    "Vendor service unavailable (HTTP " + statusCode + ")", statusCode, false, null));
        }
    }

    @Getter
    @RequiredArgsConstructor
    public static final class ContentFiltered extends VendorResponse {
        private final String finishReason;
        private final String prompt;
        private final List<ModerationCategory> categories;

        @Override
        public PollResult toPollResult() {
            return PollResult.failed(new ModerationRejectedException(finishReason, prompt, categories));
        }
    }

    @Getter
    @RequiredArgsConstructor
    public static final class Rejected extends VendorResponse {
        private final int statusCode;
        private final String message;

        @Override
        public PollResult toPollResult() {
            return PollResult.failed(new TerminalStageException(message, statusCode));
        }
    }
}
