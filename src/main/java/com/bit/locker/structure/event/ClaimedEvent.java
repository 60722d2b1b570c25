package com.bit.locker.structure.event;

import com.bit.locker.common.Address;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.math.BigInteger;

@Getter
@ToString
@EqualsAndHashCode(callSuper = false)
public class ClaimedEvent extends LedgerEvent {
    private final Address user;
    private final BigInteger amount;

    public ClaimedEvent(Address user, BigInteger amount) {
        this.user = user;
        this.amount = amount;
    }
}
