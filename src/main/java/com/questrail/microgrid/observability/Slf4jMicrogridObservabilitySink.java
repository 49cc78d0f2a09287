package com.questrail.microgrid.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of MicrogridObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jMicrogridObservabilitySink implements MicrogridObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jMicrogridObservabilitySink.class);

    @Override
    public void onStateTransition(ComponentTransitionEvent event) {
        if (event.isStateChange()) {
            log.info("{}: {} -> {} ({})",
                event.componentId(),
                event.oldState(),
                event.newState(),
                event.trigger());
        }
        event.pending().ifPresent(target ->
            log.info("{}: settling towards {} ({})", event.componentId(), target, event.trigger()));
    }

    @Override
    public void onPowerCommand(PowerCommandEvent event) {
        if (event instanceof PowerCommandEvent.Installed e) {
            log.debug("{}: {} power {} (requested {}) valid until {}",
                e.componentId(), e.kind(), e.applied(), e.requested(), e.validUntil());
        } else if (event instanceof PowerCommandEvent.Reverted e) {
            log.info("{}: {} power command {} expired, reverted to 0",
                e.componentId(), e.kind(), e.previous());
        }
    }

    @Override
    public void onBoundsEvent(BoundsEvent event) {
        if (event instanceof BoundsEvent.Violated e) {
            log.warn("{}: {} sample {} outside bounds {}",
                e.componentId(), e.metric(), e.value(), e.active());
        } else {
            log.debug("Bounds event: {}", event);
        }
    }

    @Override
    public void onError(ControlErrorEvent event) {
        log.error("{}: {}", event.componentId(), event.message(), event.cause());
    }
}
