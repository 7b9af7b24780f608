package com.videopipe.orchestrator.service.error;

import lombok.Getter;

import java.util.List;

/**
 * 벤더의 콘텐츠 안전 필터에 의해 요청이 거부되었을 때 발생하는 예외
 * 대체 입력(프롬프트 순화) 재시도에 필요한 정보를 담고 있음
 */
@Getter
public class ModerationRejectedException extends StageException {

    private final String finishReason;                 // SAFETY, BLOCKED, CONTENT_POLICY 등
    private final String originalPrompt;
    private final List<ModerationCategory> categories;

    public ModerationRejectedException(String finishReason, String originalPrompt, List<ModerationCategory> categories) {
        super(buildMessage(finishReason, categories), 400);
        this.finishReason = finishReason;
        this.originalPrompt = originalPrompt;
        this.categories = categories == null ? List.of() : List.copyOf(categories);
    }

    private static String buildMessage(String finishReason, List<ModerationCategory> categories) {
        StringBuilder sb = new StringBuilder();
        sb.append("Request blocked by content moderation. Reason: ").append(finishReason);

        if (categories != null && !categories.isEmpty()) {
            sb.append(". Blocked categories: ");
            categories.stream()
                    .filter(ModerationCategory::isBlocked)
                    .forEach(c -> sb.append("[").append(c.getCategory())
                            .append(": ").append(c.getSeverity()).append("] "));
        }

        return sb.toString().trim();
    }

    /**
     * 감사 기록과 로그에 남길 카테고리 요약
     */
    public String getModerationIssueDescription() {
        if (categories.isEmpty()) {
            return "unknown category";
        }
        StringBuilder sb = new StringBuilder();
        for (ModerationCategory category : categories) {
            if (category.isBlocked() || "HIGH".equals(category.getSeverity())) {
                if (sb.length() > 0) {
                    sb.append(", ");
                }
                sb.append(formatCategory(category.getCategory()))
                        .append(" (").append(category.getSeverity()).append(")");
            }
        }
        return sb.length() > 0 ? sb.toString() : "unknown category";
    }

    private String formatCategory(String category) {
        if (category == null) return "unknown";
        return category.replace("HARM_CATEGORY_", "")
                .replace("_", " ")
                .toLowerCase();
    }

    @Getter
    public static class ModerationCategory {
        private final String category;    // HARM_CATEGORY_VIOLENCE 등
        private final String severity;    // HIGH, MEDIUM, LOW
        private final boolean blocked;

        public ModerationCategory(String category, String severity, boolean blocked) {
            this.category = category;
            this.severity = severity;
            this.blocked = blocked;
        }
    }
}
