package com.pointbreak.award.enums;

public enum SessionState {
    WARMING,
    READY,
    BUSY,
    // scheduled for replacement, never leased again
    DEGRADED,
    RETIRED
}
