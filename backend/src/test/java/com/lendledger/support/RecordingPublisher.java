package com.lendledger.support;

import com.lendledger.event.LedgerEvent;
import com.lendledger.event.LedgerEventPublisher;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

public class RecordingPublisher implements LedgerEventPublisher {

    private final List<LedgerEvent> events = new ArrayList<>();

    @Override
    public void publish(LedgerEvent event) {
        events.add(event);
    }

    public List<LedgerEvent> all() {
        return events;
    }

    public <T extends LedgerEvent> List<T> ofType(Class<T> type) {
        return events.stream().filter(type::isInstance).map(type::cast).collect(Collectors.toList());
    }

    public void clear() {
        events.clear();
    }
}
