package com.deploypilot.engine.model;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.UUID;

/**
 * Immutable snapshot of one revision of a pipeline definition.
 *
 * DB table: pipeline_versions  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "pipeline_versions")
public class PipelineVersion {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "pipeline_id", nullable = false, updatable = false)
    private UUID pipelineId;

    @Column(nullable = false, updatable = false)
    private int version;

    @Column(name = "definition_yaml", nullable = false, updatable = false, columnDefinition = "TEXT")
    private String definitionYaml;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    protected PipelineVersion() {}   // required by JPA

    public PipelineVersion(UUID pipelineId, int version, String definitionYaml) {
        this.pipelineId     = pipelineId;
        this.version        = version;
        this.definitionYaml = definitionYaml;
    }

    public UUID    getId()             { return id; }
    public UUID    getPipelineId()     { return pipelineId; }
    public int     getVersion()        { return version; }
    public String  getDefinitionYaml() { return definitionYaml; }
    public Instant getCreatedAt()      { return createdAt; }
}
