package com.trackflow.service;

/**
 * How the soak-time check takes part in a validation.
 */
public enum AgeGate {
    /** Young tracks fail validation. */
    ENFORCED,
    /** Check is still reported but does not count, if the bypass policy allows it. */
    BYPASSED
}
