package com.questrail.options.observability;

/**
 * No-op implementation of OptionObservabilitySink.
 */
public final class NullOptionObservabilitySink implements OptionObservabilitySink {
    public static final NullOptionObservabilitySink INSTANCE = new NullOptionObservabilitySink();

    private NullOptionObservabilitySink() {}

    @Override
    public void onChange(OptionChangeEvent event) {}

    @Override
    public void onError(OptionErrorEvent event) {}
}
