package com.videopipe.orchestrator.mapper;

import com.videopipe.orchestrator.entity.SceneJob;
import org.apache.ibatis.annotations.Mapper;

import java.util.List;
import java.util.Optional;

@Mapper
public interface SceneJobMapper {

    void insert(SceneJob sceneJob);

    int update(SceneJob sceneJob);

    Optional<SceneJob> findById(String sceneJobId);

    List<SceneJob> findByPipelineJobIdOrderByIndex(String pipelineJobId);
}
