package com.questrail.wrpbridge.observability;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Test sink that records events for assertions.
 */
public final class RecordingObservabilitySink implements BridgeObservabilitySink {
    private final List<Object> events = new ArrayList<>();

    @Override
    public synchronized void onListenerEvent(ListenerEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void onConnectionEvent(ConnectionEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void onError(BridgeErrorEvent event) {
        events.add(event);
    }

    public synchronized List<Object> getAllEvents() {
        return new ArrayList<>(events);
    }

    public synchronized List<ListenerEvent.Kind> listenerKinds() {
        return events.stream()
            .filter(e -> e instanceof ListenerEvent)
            .map(e -> ((ListenerEvent) e).kind())
            .collect(Collectors.toList());
    }

    public synchronized List<ConnectionEvent> connectionEvents() {
        return events.stream()
            .filter(e -> e instanceof ConnectionEvent)
            .map(e -> (ConnectionEvent) e)
            .collect(Collectors.toList());
    }

    public synchronized <T> boolean hasEventOfType(Class<T> type) {
        return events.stream().anyMatch(type::isInstance);
    }
}
