package com.hcltech.bgjobs.jobs;

/** Lifecycle of a {@link Jobs} barrier. Transitions only move forward. */
public enum BarrierState {
    CREATED,
    /** The caller's logic is running and may launch jobs. */
    OPEN,
    /** The logic has returned; waiting for the jobs still running. */
    DRAINING,
    /** Every slot is free again. */
    CLOSED
}
