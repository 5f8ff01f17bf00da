package com.questrail.rover.observability;

/**
 * No-op implementation of RoverObservabilitySink.
 */
public final class NullObservabilitySink implements RoverObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onLanded(RoverLandedEvent event) {}

    @Override
    public void onCommandsCompleted(CommandStringCompletedEvent event) {}

    @Override
    public void onCommandsHalted(CommandStringHaltedEvent event) {}
}
