package com.deploypilot.engine.model;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.UUID;

/**
 * One attempt to execute a pipeline, either as a local sandbox dry run or
 * as a run triggered on the remote CI backend.
 *
 * Append-only history: once the status is terminal nothing but the poll
 * lease columns changes. A rollback is a new row pointing at the run it
 * supersedes through previous_execution_id.
 *
 * completed_at is non-null exactly when the status is terminal; the
 * {@code ExecutionStateMachine} is the only code that moves the status.
 *
 * DB table: execution_runs  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "execution_runs")
public class ExecutionRun {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "pipeline_id", nullable = false, updatable = false)
    private UUID pipelineId;

    // Definition version that was executed.
    @Column(name = "pipeline_version", nullable = false, updatable = false)
    private int pipelineVersion;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false)
    private ExecutionKind kind;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private PipelineStatus status = PipelineStatus.BUILDING;

    @Enumerated(EnumType.STRING)
    @Column(name = "trigger_type", nullable = false)
    private TriggerType triggerType = TriggerType.MANUAL;

    // Remote run identifiers, null for LOCAL runs and for exhausted triggers.
    @Column(name = "remote_build_number")
    private Long remoteBuildNumber;

    @Column(name = "remote_run_uuid")
    private String remoteRunUuid;

    @Column(name = "remote_commit_hash")
    private String remoteCommitHash;

    @Column(name = "branch")
    private String branch;

    // Number of trigger attempts that were made (remote runs only).
    @Column(name = "trigger_attempts", nullable = false)
    private int triggerAttempts = 0;

    @Column(columnDefinition = "TEXT")
    private String logs;

    @Column(name = "error_message", columnDefinition = "TEXT")
    private String errorMessage;

    // Rollback linkage.
    @Column(name = "rolled_back", nullable = false)
    private boolean rolledBack = false;

    @Column(name = "rollback_reason", columnDefinition = "TEXT")
    private String rollbackReason;

    @Column(name = "previous_execution_id")
    private UUID previousExecutionId;

    // Short-lived claim held by the instance currently polling this run.
    @Column(name = "poll_lease_owner")
    private String pollLeaseOwner;

    @Column(name = "poll_lease_expires_at")
    private Instant pollLeaseExpiresAt;

    @Column(name = "started_at", nullable = false, updatable = false)
    private Instant startedAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    @Column(name = "duration_seconds")
    private Long durationSeconds;

    // ------------------------------------------------------------------
    // Constructors
    // ------------------------------------------------------------------

    protected ExecutionRun() {}   // required by JPA

    public ExecutionRun(UUID pipelineId, int pipelineVersion, ExecutionKind kind, TriggerType triggerType,
                        Instant startedAt) {
        this.pipelineId      = pipelineId;
        this.pipelineVersion = pipelineVersion;
        this.kind            = kind;
        this.triggerType     = triggerType;
        this.startedAt       = startedAt;
    }

    // ------------------------------------------------------------------
    // Getters / setters
    // ------------------------------------------------------------------

    public UUID           getId()                  { return id; }
    public UUID           getPipelineId()          { return pipelineId; }
    public int            getPipelineVersion()     { return pipelineVersion; }
    public ExecutionKind  getKind()                { return kind; }
    public PipelineStatus getStatus()              { return status; }
    public TriggerType    getTriggerType()         { return triggerType; }
    public Long           getRemoteBuildNumber()   { return remoteBuildNumber; }
    public String         getRemoteRunUuid()       { return remoteRunUuid; }
    public String         getRemoteCommitHash()    { return remoteCommitHash; }
    public String         getBranch()              { return branch; }
    public int            getTriggerAttempts()     { return triggerAttempts; }
    public String         getLogs()                { return logs; }
    public String         getErrorMessage()        { return errorMessage; }
    public boolean        isRolledBack()           { return rolledBack; }
    public String         getRollbackReason()      { return rollbackReason; }
    public UUID           getPreviousExecutionId() { return previousExecutionId; }
    public String         getPollLeaseOwner()      { return pollLeaseOwner; }
    public Instant        getPollLeaseExpiresAt()  { return pollLeaseExpiresAt; }
    public Instant        getStartedAt()           { return startedAt; }
    public Instant        getCompletedAt()         { return completedAt; }
    public Long           getDurationSeconds()     { return durationSeconds; }

    // Package-private: status and completion only move through ExecutionStateMachine.
    void setStatus(PipelineStatus status)            { this.status = status; }
    void setCompletedAt(Instant completedAt)         { this.completedAt = completedAt; }

    public void setDurationSeconds(Long seconds)     { this.durationSeconds = seconds; }
    public void setLogs(String logs)                 { this.logs = logs; }
    public void setErrorMessage(String errorMessage) { this.errorMessage = errorMessage; }
    public void setBranch(String branch)             { this.branch = branch; }
    public void setTriggerAttempts(int attempts)     { this.triggerAttempts = attempts; }

    public void setRemoteIdentifiers(String runUuid, Long buildNumber, String commitHash) {
        this.remoteRunUuid     = runUuid;
        this.remoteBuildNumber = buildNumber;
        this.remoteCommitHash  = commitHash;
    }

    public void markAsRollbackOf(UUID previousExecutionId, String reason) {
        this.previousExecutionId = previousExecutionId;
        this.rolledBack          = true;
        this.rollbackReason      = reason;
    }
}
