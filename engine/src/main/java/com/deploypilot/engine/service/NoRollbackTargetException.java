package com.deploypilot.engine.service;

import java.util.UUID;

/** No successful run with a known commit precedes the run being rolled back. */
public class NoRollbackTargetException extends RuntimeException {

    public NoRollbackTargetException(UUID executionId) {
        super("No earlier successful execution to roll back to from " + executionId);
    }
}
