package com.videopipe.orchestrator.mapper;

import com.videopipe.orchestrator.entity.StageCallRecord;
import org.apache.ibatis.annotations.Mapper;

import java.util.List;

@Mapper
public interface StageCallRecordMapper {

    void insert(StageCallRecord record);

    List<StageCallRecord> findByPipelineJobId(String pipelineJobId);
}
