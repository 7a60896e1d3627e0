package com.finopti.support;

import com.finopti.observability.ObservabilityEvent;
import com.finopti.observability.ObservabilitySink;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

public class RecordingSink implements ObservabilitySink {

    private final List<ObservabilityEvent> events = new CopyOnWriteArrayList<>();

    @Override
    public void publish(ObservabilityEvent event) {
        events.add(event);
    }

    public List<ObservabilityEvent> getEvents() {
        return events;
    }

    public List<String> eventNames() {
        return events.stream().map(ObservabilityEvent::getEvent).collect(Collectors.toList());
    }
}
