package com.project.graph.digitizer.service;

/** What the caller of the digitizer does with a flat trace. */
public enum DegenerateRangePolicy {
    /** Report the failure. */
    REJECT,
    /** Emit every matched column with amplitude 0. */
    ZERO
}
