package com.questrail.options.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of OptionObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jOptionObservabilitySink implements OptionObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jOptionObservabilitySink.class);

    @Override
    public void onChange(OptionChangeEvent event) {
        log.info("Option {}: '{}' -> '{}'", event.option(), event.oldText(), event.newText());
    }

    @Override
    public void onError(OptionErrorEvent event) {
        log.warn("Option {}: {}", event.option(), event.message(), event.cause());
    }
}
