package com.pattern.sandbox;

/**
 * How one sandboxed script run ended.
 */
public enum Termination {
    /** Ran to completion and returned a value. */
    COMPLETED,
    /** Refused by the static scan and never compiled. */
    REJECTED,
    /** Aborted for exceeding its time budget. */
    TIMED_OUT,
    /** Failed to compile or threw. */
    FAILED
}
