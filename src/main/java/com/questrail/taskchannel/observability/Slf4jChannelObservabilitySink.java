package com.questrail.taskchannel.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of ChannelObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jChannelObservabilitySink implements ChannelObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jChannelObservabilitySink.class);

    @Override
    public void onStateTransition(ChannelStateTransitionEvent event) {
        log.info("Task channel state: {} -> {} ({})",
            event.oldState(),
            event.newState(),
            event.reason());
    }

    @Override
    public void onTransportEvent(ChannelTransportEvent event) {
        switch (event.kind()) {
            case OPENING -> log.debug("Task channel transport opening: {}", event.detail());
            case OPENED -> log.info("Task channel transport open: {}", event.detail());
            default -> log.info("Task channel transport {}: code={} {}",
                event.kind(), event.closeCode(), event.detail());
        }
    }

    @Override
    public void onReconnectScheduled(ChannelReconnectEvent event) {
        log.info("Attempting reconnection {}/{} in {}ms",
            event.attempt(),
            event.maxAttempts(),
            event.delay().toMillis());
    }

    @Override
    public void onError(ChannelErrorEvent event) {
        switch (event.kind()) {
            case RECONNECT_EXHAUSTED, CALLBACK_ERROR ->
                log.error("Task channel {}: {}", event.kind(), event.message(), event.cause());
            default ->
                log.warn("Task channel {}: {}", event.kind(), event.message(), event.cause());
        }
    }
}
