package com.libragraph.vcl.core.reclaim;

/**
 * Progress of a single reclaim pass.
 */
public enum ReclaimStage {
    IDLE,
    DEPTH_ENFORCING,
    PRIORITY_EVICTING,
    ORPHAN_SWEEPING,
    DONE
}
