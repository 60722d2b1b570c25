package com.bit.locker.structure.event;

import com.bit.locker.common.Address;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.math.BigInteger;

@Getter
@ToString
@EqualsAndHashCode(callSuper = false)
public class DepositEvent extends LedgerEvent {
    private final Address user;
    private final int poolId;
    private final BigInteger amount;
    // 解锁时间（秒）
    private final long unlockTime;

    public DepositEvent(Address user, int poolId, BigInteger amount, long unlockTime) {
        this.user = user;
        this.poolId = poolId;
        this.amount = amount;
        this.unlockTime = unlockTime;
    }
}
