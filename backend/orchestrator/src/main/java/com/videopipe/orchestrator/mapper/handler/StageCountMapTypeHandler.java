package com.videopipe.orchestrator.mapper.handler;

import com.fasterxml.jackson.core.type.TypeReference;
import com.videopipe.common.enums.StageType;

import java.util.EnumMap;
import java.util.Map;

public class StageCountMapTypeHandler extends JsonTypeHandler<Map<StageType, Integer>> {

    public StageCountMapTypeHandler() {
        super(new TypeReference<EnumMap<StageType, Integer>>() {
        });
    }

    @Override
    protected Map<StageType, Integer> emptyValue() {
        return new EnumMap<>(StageType.class);
    }
}
