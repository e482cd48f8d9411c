package com.questrail.taskchannel.observability;

import com.questrail.taskchannel.api.ChannelErrorKind;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Test sink that records events for assertions.
 */
public final class RecordingObservabilitySink implements ChannelObservabilitySink {
    private final List<Object> events = new ArrayList<>();

    @Override
    public synchronized void onStateTransition(ChannelStateTransitionEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void onTransportEvent(ChannelTransportEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void onReconnectScheduled(ChannelReconnectEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void onError(ChannelErrorEvent event) {
        events.add(event);
    }

    public synchronized List<Object> getAllEvents() {
        return new ArrayList<>(events);
    }

    public synchronized List<ChannelStateTransitionEvent> getStateTransitions() {
        return ofType(ChannelStateTransitionEvent.class);
    }

    public synchronized List<ChannelReconnectEvent> getReconnects() {
        return ofType(ChannelReconnectEvent.class);
    }

    public synchronized List<ChannelErrorEvent> getErrors(ChannelErrorKind kind) {
        return ofType(ChannelErrorEvent.class).stream()
            .filter(e -> e.kind() == kind)
            .collect(Collectors.toList());
    }

    public synchronized <T> boolean hasEventOfType(Class<T> type) {
        return events.stream().anyMatch(type::isInstance);
    }

    private <T> List<T> ofType(Class<T> type) {
        return events.stream()
            .filter(type::isInstance)
            .map(type::cast)
            .collect(Collectors.toList());
    }
}
