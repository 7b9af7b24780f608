package com.videopipe.orchestrator.mapper.handler;

import com.fasterxml.jackson.core.type.TypeReference;
import com.videopipe.common.enums.StageType;

import java.util.EnumMap;
import java.util.Map;

public class StageAssetMapTypeHandler extends JsonTypeHandler<Map<StageType, String>> {

    public StageAssetMapTypeHandler() {
        super(new TypeReference<EnumMap<StageType, String>>() {
        });
    }

    @Override
    protected Map<StageType, String> emptyValue() {
        return new EnumMap<>(StageType.class);
    }
}
