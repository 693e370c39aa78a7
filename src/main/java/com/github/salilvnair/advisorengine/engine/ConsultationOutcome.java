package com.github.salilvnair.advisorengine.engine;

/**
 * How a consultation brief came to be.
 */
public enum ConsultationOutcome {
    /** Model-derived brief over retrieved passages. */
    NOMINAL,
    /** Usable brief, but retrieval, generation or extraction fell back somewhere. */
    DEGRADED,
    /** The model refused; the brief is the fixed educational response. */
    POLICY_VIOLATION
}
