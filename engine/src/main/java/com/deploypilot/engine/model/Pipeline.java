package com.deploypilot.engine.model;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.UUID;

/**
 * The deployment pipeline of one repository.
 *
 * The definition is versioned: every edit appends a {@link PipelineVersion}
 * and bumps {@code version}, while the Pipeline keeps its identity. Only one
 * pipeline per repository is active at a time (partial unique index in V1).
 *
 * DB table: pipelines  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "pipelines")
public class Pipeline {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    // Opaque key of the owning repository; repositories live outside this service.
    @Column(name = "repository_key", nullable = false)
    private String repositoryKey;

    @Column(name = "remote_workspace", nullable = false)
    private String remoteWorkspace;

    @Column(name = "remote_repo_slug", nullable = false)
    private String remoteRepoSlug;

    // Clonable URL or local path used by sandbox dry runs.
    @Column(name = "source_url")
    private String sourceUrl;

    @Column(name = "default_branch", nullable = false)
    private String defaultBranch = "main";

    @Column(name = "deployment_server")
    private String deploymentServer;

    @Column(nullable = false)
    private int version = 1;

    @Column(name = "definition_yaml", nullable = false, columnDefinition = "TEXT")
    private String definitionYaml;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private PipelineStatus status = PipelineStatus.PLANNED;

    @Column(nullable = false)
    private boolean active = true;

    // Transcript and error of the most recent sandbox dry run.
    @Column(name = "test_output", columnDefinition = "TEXT")
    private String testOutput;

    @Column(name = "error_message", columnDefinition = "TEXT")
    private String errorMessage;

    @Column(name = "last_execution_at")
    private Instant lastExecutionAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt = Instant.now();

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    // ------------------------------------------------------------------
    // Constructors
    // ------------------------------------------------------------------

    protected Pipeline() {}   // required by JPA

    public Pipeline(String repositoryKey, String remoteWorkspace, String remoteRepoSlug, String definitionYaml) {
        this.repositoryKey   = repositoryKey;
        this.remoteWorkspace = remoteWorkspace;
        this.remoteRepoSlug  = remoteRepoSlug;
        this.definitionYaml  = definitionYaml;
    }

    // ------------------------------------------------------------------
    // Getters / setters
    // ------------------------------------------------------------------

    public UUID           getId()               { return id; }
    public String         getRepositoryKey()    { return repositoryKey; }
    public String         getRemoteWorkspace()  { return remoteWorkspace; }
    public String         getRemoteRepoSlug()   { return remoteRepoSlug; }
    public String         getSourceUrl()        { return sourceUrl; }
    public String         getDefaultBranch()    { return defaultBranch; }
    public String         getDeploymentServer() { return deploymentServer; }
    public int            getVersion()          { return version; }
    public String         getDefinitionYaml()   { return definitionYaml; }
    public PipelineStatus getStatus()           { return status; }
    public boolean        isActive()            { return active; }
    public String         getTestOutput()       { return testOutput; }
    public String         getErrorMessage()     { return errorMessage; }
    public Instant        getLastExecutionAt()  { return lastExecutionAt; }
    public Instant        getCreatedAt()        { return createdAt; }
    public Instant        getUpdatedAt()        { return updatedAt; }

    public void setSourceUrl(String sourceUrl)               { this.sourceUrl = sourceUrl; }
    public void setDefaultBranch(String defaultBranch)       { this.defaultBranch = defaultBranch; }
    public void setDeploymentServer(String deploymentServer) { this.deploymentServer = deploymentServer; }
    public void setStatus(PipelineStatus status)             { this.status = status; }
    public void setActive(boolean active)                    { this.active = active; }
    public void setTestOutput(String testOutput)             { this.testOutput = testOutput; }
    public void setErrorMessage(String errorMessage)         { this.errorMessage = errorMessage; }
    public void setLastExecutionAt(Instant t)                { this.lastExecutionAt = t; }

    /**
     * Replace the current definition and bump the version number.
     * The caller is responsible for appending the matching PipelineVersion row.
     */
    public void nextVersion(String definitionYaml) {
        this.definitionYaml = definitionYaml;
        this.version++;
        this.status = PipelineStatus.PLANNED;
    }
}
