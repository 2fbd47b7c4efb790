package com.intteq.fluent.broker.core;

/**
 * What a transport does when the queue, topic or table behind a route does not exist.
 */
public enum OnMissingChannel {

    /** Declare the missing infrastructure. */
    CREATE,

    /** Check that the infrastructure exists and fail if it does not. */
    VALIDATE,

    /** Assume the infrastructure exists. */
    ASSUME
}
