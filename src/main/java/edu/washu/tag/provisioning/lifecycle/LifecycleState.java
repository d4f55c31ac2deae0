package edu.washu.tag.provisioning.lifecycle;

/**
 * Position of a {@link ResourceLifecycle} in the run / class / test nesting.
 */
public enum LifecycleState {
    UNINITIALIZED,
    RUN_ACTIVE,
    CLASS_ACTIVE,
    TEST_ACTIVE,
    TORN_DOWN
}
