package com.videopipe.orchestrator.mapper.handler;

import com.fasterxml.jackson.core.type.TypeReference;
import com.videopipe.common.enums.StageType;

import java.util.EnumSet;
import java.util.Set;

public class StageSetTypeHandler extends JsonTypeHandler<Set<StageType>> {

    public StageSetTypeHandler() {
        super(new TypeReference<EnumSet<StageType>>() {
        });
    }

    @Override
    protected Set<StageType> emptyValue() {
        return EnumSet.noneOf(StageType.class);
    }
}
