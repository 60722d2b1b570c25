package com.bit.locker.structure.event;

/**
 * 账本对外通知事件，按发生顺序发布
 */
public abstract class LedgerEvent {

    public String getType() {
        return getClass().getSimpleName().replace("Event", "");
    }
}
