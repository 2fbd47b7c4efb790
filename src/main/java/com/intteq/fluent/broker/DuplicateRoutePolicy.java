package com.intteq.fluent.broker;

/**
 * What happens when two registrations claim the same subscription identity or destination.
 */
public enum DuplicateRoutePolicy {

    /** Last registration wins silently. */
    OVERWRITE,

    /** Last registration wins and a warning is logged. */
    WARN,

    /** Registration fails with a {@link com.intteq.fluent.broker.exception.DuplicateRouteException}. */
    FAIL
}
