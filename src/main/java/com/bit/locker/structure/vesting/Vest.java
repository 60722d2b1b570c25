package com.bit.locker.structure.vesting;

import lombok.Getter;
import lombok.ToString;

import java.math.BigInteger;

/**
 * 线性释放授予
 * startDate 时 startAmount 可领，之后线性增长至 endDate 时的 totalAmount
 */
@Getter
@ToString
public class Vest {

    private final BigInteger startAmount;
    private final BigInteger totalAmount;
    private final long startDate;
    private final long endDate;

    // 累计已领取
    private BigInteger claimed;

    public Vest(BigInteger startAmount, BigInteger totalAmount, long startDate, long endDate) {
        this(startAmount, totalAmount, startDate, endDate, BigInteger.ZERO);
    }

    private Vest(BigInteger startAmount, BigInteger totalAmount, long startDate, long endDate, BigInteger claimed) {
        this.startAmount = startAmount;
        this.totalAmount = totalAmount;
        this.startDate = startDate;
        this.endDate = endDate;
        this.claimed = claimed;
    }

    public void addClaimed(BigInteger amount) {
        BigInteger next = claimed.add(amount);
        if (next.compareTo(totalAmount) > 0) {
            throw new IllegalStateException("领取超出授予总量 " + next + " > " + totalAmount);
        }
        claimed = next;
    }

    public BigInteger unclaimed() {
        return totalAmount.subtract(claimed);
    }

    public Vest copy() {
        return new Vest(startAmount, totalAmount, startDate, endDate, claimed);
    }
}
