package com.videopipe.orchestrator.mapper.handler;

import com.fasterxml.jackson.core.type.TypeReference;

import java.util.ArrayList;
import java.util.List;

public class StringListTypeHandler extends JsonTypeHandler<List<String>> {

    public StringListTypeHandler() {
        super(new TypeReference<ArrayList<String>>() {
        });
    }

    @Override
    protected List<String> emptyValue() {
        return new ArrayList<>();
    }
}
