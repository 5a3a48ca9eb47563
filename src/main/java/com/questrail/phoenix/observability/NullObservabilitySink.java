package com.questrail.phoenix.observability;

/**
 * No-op implementation of PhoenixObservabilitySink.
 */
public final class NullObservabilitySink implements PhoenixObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onTransportEvent(PhoenixTransportEvent event) {}

    @Override
    public void onProtocolEvent(PhoenixProtocolEvent event) {}

    @Override
    public void onError(PhoenixErrorEvent event) {}
}
