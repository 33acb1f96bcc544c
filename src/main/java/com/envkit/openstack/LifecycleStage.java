package com.envkit.openstack;

public enum LifecycleStage {
    UNPROVISIONED,
    REQUESTED,
    ADDRESS_ASSIGNED,
    SHELL_READY,
    BOOTSTRAPPED
}
