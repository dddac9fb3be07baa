package com.mendloop.core.model;

/**
 * States of the convergence loop.
 */
public enum LoopStatus {
    SETUP,
    WORKING,
    EVALUATING,
    ANALYZING,
    DONE_PASS,
    DONE_CEILING,
    ABORTED;

    public boolean isTerminal() {
        return this == DONE_PASS || this == DONE_CEILING || this == ABORTED;
    }
}
