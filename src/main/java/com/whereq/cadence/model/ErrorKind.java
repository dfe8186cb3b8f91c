package com.whereq.cadence.model;

/**
 * Why an analysis call failed. Every kind is currently retried the same way.
 */
public enum ErrorKind {
    /**
     * Network failure, timeout or server error
     */
    TRANSIENT,

    /**
     * The analysis service rejected the call because its request quota is used up
     */
    QUOTA_EXHAUSTED,

    /**
     * The analysis service answered with something that is not a result
     */
    INVALID_RESPONSE
}
