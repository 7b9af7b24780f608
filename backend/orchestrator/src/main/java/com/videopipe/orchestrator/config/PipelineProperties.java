package com.videopipe.orchestrator.config;

import com.videopipe.common.enums.StageType;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 파이프라인 오케스트레이션 설정 (application.yml 의 pipeline.*)
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "pipeline")
public class PipelineProperties {

    /** 단계별 동시 실행 한도 */
    private Map<StageType, Integer> concurrency = defaultConcurrency();

    private Retry retry = new Retry();

    private Timeout timeout = new Timeout();

    /** 외부 작업 상태 폴링 간격 */
    private Duration pollInterval = Duration.ofSeconds(2);

    /** 실패한 씬이 있을 때 합성 정책 */
    private AssemblyPolicy assemblyPolicy = AssemblyPolicy.REQUIRE_ALL;

    /** 작업당 비용 한도 (null 이면 무제한) */
    private BigDecimal costBudget;

    /** scriptRef 를 해석할 기준 디렉터리 */
    private String scriptDir = "./scripts";

    /** 시작 시 미완료 작업 복구 여부 */
    private boolean recoverOnStartup = true;

    private Progress progress = new Progress();

    private Map<StageType, Pacing> pacing = new EnumMap<>(StageType.class);

    private Moderation moderation = new Moderation();

    private Store store = new Store();

    private Simulated simulated = new Simulated();

    public int concurrencyOf(StageType stage) {
        Integer limit = concurrency.get(stage);
        return limit != null && limit > 0 ? limit : 1;
    }

    public Duration timeoutOf(StageType stage) {
        Duration perStage = timeout.getPerStage().get(stage);
        return perStage != null ? perStage : timeout.getDefaultTimeout();
    }

    public int maxAttemptsOf(StageType stage) {
        Integer perStage = retry.getMaxAttemptsPerStage().get(stage);
        return perStage != null && perStage > 0 ? perStage : retry.getMaxAttempts();
    }

    private static Map<StageType, Integer> defaultConcurrency() {
        Map<StageType, Integer> map = new EnumMap<>(StageType.class);
        map.put(StageType.SCRIPT, 8);
        map.put(StageType.VOICE, 4);
        map.put(StageType.VISUAL, 3);
        map.put(StageType.VIDEO_CLIP, 2);
        map.put(StageType.ASSEMBLY, 1);
        map.put(StageType.UPLOAD, 2);
        return map;
    }

    public enum AssemblyPolicy {
        /** 모든 씬이 READY 여야 합성 */
        REQUIRE_ALL,
        /** 실패한 씬은 제외하고 합성 */
        OMIT_FAILED
    }

    @Getter
    @Setter
    public static class Retry {
        private int maxAttempts = 3;
        private Map<StageType, Integer> maxAttemptsPerStage = new EnumMap<>(StageType.class);
        private Duration baseDelay = Duration.ofSeconds(2);
        private Duration maxDelay = Duration.ofSeconds(60);
        private double multiplier = 2.0;
        private double jitterRatio = 0.25;
    }

    @Getter
    @Setter
    public static class Timeout {
        private Duration defaultTimeout = Duration.ofMinutes(10);
        private Map<StageType, Duration> perStage = new EnumMap<>(StageType.class);
    }

    @Getter
    @Setter
    public static class Progress {
        private int subscriberQueueSize = 256;
        private Duration sseDrainInterval = Duration.ofMillis(250);
        private Duration sseHeartbeatInterval = Duration.ofSeconds(15);
        private Duration sseTimeout = Duration.ofMinutes(30);
    }

    /**
     * 단계별 적응형 호출 간격. 기본값은 간격 없음.
     */
    @Getter
    @Setter
    public static class Pacing {
        private long initialDelayMs = 0;
        private long minDelayMs = 0;
        private long maxDelayMs = 0;
        private double successDecreaseRatio = 0.9;
        private double errorIncreaseRatio = 1.5;
        private int successStreakForDecrease = 3;
    }

    @Getter
    @Setter
    public static class Moderation {
        /** 치환 사전 (단어 → 완곡 표현). 비어 있으면 기본 사전 사용 */
        private Map<String, String> substitutions = new LinkedHashMap<>();
        /** 시각 단계 프롬프트에 덧붙이는 스타일 문구 */
        private String visualSuffix = "tasteful, non-graphic, cinematic lighting";
    }

    @Getter
    @Setter
    public static class Store {
        /** mybatis | memory */
        private String type = "mybatis";
    }

    /**
     * 내장 시뮬레이션 어댑터 설정
     */
    @Getter
    @Setter
    public static class Simulated {
        private boolean enabled = true;
        private Duration latency = Duration.ofSeconds(3);
        /** 일시 오류(503/429) 주입 확률 0.0 ~ 1.0 */
        private double transientFailureRate = 0.0;
        private List<String> blockedTerms = new ArrayList<>(List.of(
                "blood", "gore", "weapon", "gun", "knife", "violence", "killing",
                "nude", "naked", "sexual", "erotic", "nazi", "terrorist", "cocaine", "heroin"));
        private BigDecimal costPerCall = new BigDecimal("0.0100");
        private String assetBaseUri = "sim://assets";
    }
}
