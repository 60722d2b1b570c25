package com.bit.locker.structure.stake;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.math.BigInteger;

/**
 * 用户的一笔质押仓位（本金+奖励在存入时确定）
 */
@Getter
@ToString
@EqualsAndHashCode
public class Position {

    private final long unlockTime;

    private final BigInteger totalAmount;

    public Position(long unlockTime, BigInteger totalAmount) {
        this.unlockTime = unlockTime;
        this.totalAmount = totalAmount;
    }

    public boolean isMatured(long now) {
        return now > unlockTime;
    }
}
