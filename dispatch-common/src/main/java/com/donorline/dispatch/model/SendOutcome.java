package com.donorline.dispatch.model;

/**
 * Result of one send pipeline invocation.
 */
public enum SendOutcome {
    SENT,
    ALREADY_SENT,
    CANCELLED,
    FAILED
}
