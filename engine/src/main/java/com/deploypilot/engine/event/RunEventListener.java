package com.deploypilot.engine.event;

@FunctionalInterface
public interface RunEventListener {

    void onEvent(RunEvent event);
}
