package com.example.dutyroster.constraint;

/**
 * Why a member was not a candidate for a slot.
 */
public enum EliminationReason {
    INACTIVE,
    NG_DATE,
    NG_PERIOD,
    GLOBAL_NG,
    OVERLAP,
    COOLDOWN,
    INDEX_INELIGIBLE,
    MIN_INTERVAL,
    FIXED_PATTERN_OFF_WEEK
}
