package com.questrail.options.observability;

import java.time.Instant;

/**
 * Record describing a change of an option value, in canonical text form.
 */
public record OptionChangeEvent(
    Instant timestamp,
    String option,
    String oldText,
    String newText
) {
}
