package com.bit.locker.event;

import com.bit.locker.structure.event.LedgerEvent;

public interface EventPublisher {

    void publish(LedgerEvent event);
}
