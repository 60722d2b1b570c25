package com.bit.locker.api;

import com.bit.locker.event.impl.MemoryEventLog;
import com.bit.locker.result.Result;
import com.bit.locker.structure.event.LedgerEvent;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
public class EventApi {

    @Autowired
    private MemoryEventLog eventLog;

    @GetMapping("/events")
    public Result<List<LedgerEvent>> events() {
        return Result.OK(eventLog.events());
    }
}
