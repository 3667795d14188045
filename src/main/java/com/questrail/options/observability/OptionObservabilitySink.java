package com.questrail.options.observability;

/**
 * Receives events about option values changing or failing to change.
 * Implementations can provide logging, metrics, or auditing.
 */
public interface OptionObservabilitySink {
    /**
     * Called after an option value actually changed.
     * @param event the change details
     */
    void onChange(OptionChangeEvent event);

    /**
     * Called when an update was rejected (malformed text, unsupported merge).
     * The value is unchanged when this is called.
     * @param event the error details
     */
    void onError(OptionErrorEvent event);
}
