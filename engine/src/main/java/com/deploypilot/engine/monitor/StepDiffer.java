package com.deploypilot.engine.monitor;

import com.deploypilot.engine.remote.dto.RemoteStepStatus;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Remembers the last state seen per step and reports only the steps that are
 * new or changed state. The first call reports every step.
 *
 * Steps are keyed by their remote uuid. A step without one is keyed by name
 * and position, since several steps may share a name ("Unnamed step").
 *
 * One instance per poll loop; not thread-safe.
 */
public class StepDiffer {

    private final Map<String, String> lastSeen = new HashMap<>();
    private boolean first = true;

    public List<RemoteStepStatus> diff(List<RemoteStepStatus> steps) {
        List<RemoteStepStatus> changed = new ArrayList<>();
        for (int i = 0; i < steps.size(); i++) {
            RemoteStepStatus step = steps.get(i);
            String key = keyOf(step, i);
            boolean known = lastSeen.containsKey(key);
            String previous = lastSeen.put(key, step.state());
            if (first || !known || !Objects.equals(previous, step.state())) {
                changed.add(step);
            }
        }
        first = false;
        return changed;
    }

    static String keyOf(RemoteStepStatus step, int position) {
        if (step.uuid() != null && !step.uuid().isBlank()) {
            return step.uuid();
        }
        return step.name() + "#" + position;
    }
}
