package com.deploypilot.engine.repository;

import com.deploypilot.engine.model.PipelineVersion;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

public interface PipelineVersionRepository extends JpaRepository<PipelineVersion, UUID> {

    List<PipelineVersion> findByPipelineIdOrderByVersionDesc(UUID pipelineId);
}
