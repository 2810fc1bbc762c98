package com.deploypilot.engine.service;

import com.deploypilot.engine.model.ExecutionRun;
import com.deploypilot.engine.sandbox.SandboxRunResult;

/** Persisted LOCAL run together with the sandbox result it was built from. */
public record DryRun(ExecutionRun run, SandboxRunResult result) {}
