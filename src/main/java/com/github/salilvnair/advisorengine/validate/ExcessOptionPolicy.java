package com.github.salilvnair.advisorengine.validate;

/**
 * What the validator does with more than three options. Either way the brief
 * is flagged for review.
 */
public enum ExcessOptionPolicy {
    /** Log and keep every option. */
    KEEP_ALL,
    /** Keep the first three, log what was dropped. */
    TRUNCATE
}
