package com.bit.locker.structure.event;

import com.bit.locker.common.Address;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.math.BigInteger;

@Getter
@ToString
@EqualsAndHashCode(callSuper = false)
public class VestingAddedEvent extends LedgerEvent {
    private final Address user;
    private final BigInteger startAmount;
    private final BigInteger totalAmount;
    private final long startDate;
    private final long endDate;

    public VestingAddedEvent(Address user, BigInteger startAmount, BigInteger totalAmount, long startDate, long endDate) {
        this.user = user;
        this.startAmount = startAmount;
        this.totalAmount = totalAmount;
        this.startDate = startDate;
        this.endDate = endDate;
    }
}
