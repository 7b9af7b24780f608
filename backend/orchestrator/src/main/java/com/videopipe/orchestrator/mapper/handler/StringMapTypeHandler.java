package com.videopipe.orchestrator.mapper.handler;

import com.fasterxml.jackson.core.type.TypeReference;

import java.util.LinkedHashMap;
import java.util.Map;

public class StringMapTypeHandler extends JsonTypeHandler<Map<String, String>> {

    public StringMapTypeHandler() {
        super(new TypeReference<LinkedHashMap<String, String>>() {
        });
    }

    @Override
    protected Map<String, String> emptyValue() {
        return new LinkedHashMap<>();
    }
}
