package com.devportal.health.model;

/**
 * Why a probe, lookup or component check ended in {@link ResultStatus#ERROR}.
 */
public enum FailureKind {

    /** Cancelled by the caller. Not a genuine failure; UI layers should not alert on it. */
    ABORTED,

    /** The proxy call itself did not complete (unreachable, I/O error, timeout, bad body). */
    TRANSPORT,

    /** The proxy completed but the component answered with a non-2xx status. */
    UPSTREAM,

    /** Every system information endpoint variant was tried and none succeeded. */
    EXHAUSTED,

    /** An unexpected exception while orchestrating one component's checks. */
    ISOLATION
}
