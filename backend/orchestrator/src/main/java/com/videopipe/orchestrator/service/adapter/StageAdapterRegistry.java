package com.videopipe.orchestrator.service.adapter;

import com.videopipe.common.enums.StageType;
import com.videopipe.common.exception.ApiException;
import com.videopipe.common.exception.ErrorCode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * 단계 종류별 어댑터 조회
 */
@Slf4j
@Component
public class StageAdapterRegistry {

    private final Map<StageType, StageAdapter> adapters = new EnumMap<>(StageType.class);

    public StageAdapterRegistry(List<StageAdapter> adapterList) {
        for (StageAdapter adapter : adapterList) {
            StageAdapter previous = adapters.put(adapter.stage(), adapter);
            if (previous != null) {
                throw new IllegalStateException("Duplicate adapter for stage " + adapter.stage()
                        + ": " + previous.getClass().getSimpleName() + ", " + adapter.getClass().getSimpleName());
            }
        }
        for (StageType stage : StageType.values()) {
            if (!adapters.containsKey(stage)) {
                log.warn("[AdapterRegistry] No adapter registered for stage {}", stage);
            }
        }
        log.info("[AdapterRegistry] Registered adapters: {}", adapters.keySet());
    }

    public StageAdapter get(StageType stage) {
        StageAdapter adapter = adapters.get(stage);
        if (adapter == null) {
            throw new ApiException(ErrorCode.STAGE_ADAPTER_MISSING, "No adapter for stage " + stage);
        }
        return adapter;
    }

    public Map<StageType, StageAdapter> getAll() {
        return Collections.unmodifiableMap(adapters);
    }
}
