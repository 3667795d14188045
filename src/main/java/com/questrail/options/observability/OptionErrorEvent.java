package com.questrail.options.observability;

import java.time.Instant;

/**
 * Record describing a rejected update of an option value.
 */
public record OptionErrorEvent(
    Instant timestamp,
    String option,
    String message,
    Throwable cause
) {
}
