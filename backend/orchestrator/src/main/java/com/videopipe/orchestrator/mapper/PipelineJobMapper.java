package com.videopipe.orchestrator.mapper;

import com.videopipe.common.enums.PipelineStatus;
import com.videopipe.orchestrator.entity.PipelineJob;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.util.List;
import java.util.Optional;

@Mapper
public interface PipelineJobMapper {

    void insert(PipelineJob job);

    int update(PipelineJob job);

    Optional<PipelineJob> findById(String jobId);

    Optional<String> findIdByIdempotencyKey(String idempotencyKey);

    /**
     * 복구 대상 작업 ID (생성 순)
     */
    List<String> findIdsByStatuses(@Param("statuses") List<PipelineStatus> statuses);
}
