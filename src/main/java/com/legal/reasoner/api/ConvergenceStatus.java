package com.legal.reasoner.api;

/** Terminal outcome of a fixed-point run. Neither value is an error. */
public enum ConvergenceStatus {
    /** A step produced no change to any fact. */
    CONVERGED,
    /** The step budget {@code tmax} ran out while facts were still changing. */
    EXHAUSTED
}
