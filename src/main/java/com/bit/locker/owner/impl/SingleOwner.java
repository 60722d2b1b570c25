package com.bit.locker.owner.impl;

import com.bit.locker.common.Address;
import com.bit.locker.exception.ErrorType;
import com.bit.locker.exception.LedgerException;
import com.bit.locker.owner.Administration;
import lombok.extern.slf4j.Slf4j;

/**
 * 单一管理员，两步移交：giveOwnership -> acceptOwnership；renounce 后无人可管理
 */
@Slf4j
public class SingleOwner implements Administration {

    private Address owner;
    private Address pendingOwner = Address.ZERO;

    public SingleOwner(Address owner) {
        this.owner = owner;
    }

    @Override
    public synchronized boolean isAdministrator(Address caller) {
        return caller != null && !owner.isZero() && owner.equals(caller);
    }

    public synchronized Address owner() {
        return owner;
    }

    public synchronized Address pendingOwner() {
        return pendingOwner;
    }

    public synchronized void giveOwnership(Address caller, Address newOwner) {
        requireOwner(caller);
        if (newOwner == null || newOwner.isZero()) {
            throw new LedgerException(ErrorType.ZERO_ADDRESS);
        }
        pendingOwner = newOwner;
        log.info("管理员移交发起 {} -> {}", owner, newOwner);
    }

    public synchronized void acceptOwnership(Address caller) {
        if (pendingOwner.isZero() || !pendingOwner.equals(caller)) {
            throw new LedgerException(ErrorType.ONLY_PENDING_OWNER);
        }
        log.info("管理员变更 {} -> {}", owner, caller);
        owner = caller;
        pendingOwner = Address.ZERO;
    }

    public synchronized void renounceOwnership(Address caller) {
        requireOwner(caller);
        log.info("管理员放弃权限 {}", owner);
        owner = Address.ZERO;
        pendingOwner = Address.ZERO;
    }

    private void requireOwner(Address caller) {
        if (!isAdministrator(caller)) {
            throw new LedgerException(ErrorType.ONLY_ADMINISTRATOR);
        }
    }
}
