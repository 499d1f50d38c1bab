package com.procflow.backend.modules.lifecycle.domain;

public final class LifecycleEventType {

    public static final String INSTANCE_CREATED = "instance_created";
    public static final String TRANSITION_APPLIED = "transition_applied";

    private LifecycleEventType() {
    }
}
