package com.bit.locker.event.impl;

import com.bit.locker.event.EventPublisher;
import com.bit.locker.structure.event.LedgerEvent;
import com.google.common.collect.ImmutableList;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * 内存事件日志：按发布顺序保留全部事件，供索引方/接口读取
 */
@Slf4j
public class MemoryEventLog implements EventPublisher {

    private final List<LedgerEvent> events = new ArrayList<>();

    @Override
    public synchronized void publish(LedgerEvent event) {
        events.add(event);
        log.info("事件 {}", event);
    }

    public synchronized List<LedgerEvent> events() {
        return ImmutableList.copyOf(events);
    }

    public synchronized <T extends LedgerEvent> List<T> eventsOf(Class<T> type) {
        List<T> matched = new ArrayList<>();
        for (LedgerEvent event : events) {
            if (type.isInstance(event)) {
                matched.add(type.cast(event));
            }
        }
        return matched;
    }

    public synchronized <T extends LedgerEvent> T last(Class<T> type) {
        for (int i = events.size() - 1; i >= 0; i--) {
            if (type.isInstance(events.get(i))) {
                return type.cast(events.get(i));
            }
        }
        return null;
    }
}
