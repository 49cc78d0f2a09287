package com.questrail.microgrid.observability;

/**
 * No-op implementation of MicrogridObservabilitySink.
 */
public final class NullObservabilitySink implements MicrogridObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onStateTransition(ComponentTransitionEvent event) {}

    @Override
    public void onPowerCommand(PowerCommandEvent event) {}

    @Override
    public void onBoundsEvent(BoundsEvent event) {}

    @Override
    public void onError(ControlErrorEvent event) {}
}
