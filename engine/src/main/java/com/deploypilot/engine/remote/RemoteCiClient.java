package com.deploypilot.engine.remote;

import com.deploypilot.engine.remote.dto.RemoteRunRef;
import com.deploypilot.engine.remote.dto.RemoteRunStatus;
import com.deploypilot.engine.remote.dto.TriggerRequest;
import com.deploypilot.engine.remote.dto.TriggerResult;

/**
 * The two operations the engine needs from a remote CI backend.
 *
 * Both throw {@link TransientRemoteException} for faults worth retrying
 * (network errors, throttling, 5xx) and {@link RemoteCiException} for
 * everything else.
 */
public interface RemoteCiClient {

    TriggerResult trigger(TriggerRequest request);

    RemoteRunStatus fetchStatus(RemoteRunRef run);
}
