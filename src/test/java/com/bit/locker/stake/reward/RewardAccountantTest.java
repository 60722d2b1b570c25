package com.bit.locker.stake.reward;

import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static org.junit.jupiter.api.Assertions.*;

@Slf4j
public class RewardAccountantTest {

    @Test
    void reserveAllocatePayout() {
        RewardAccountant accountant = new RewardAccountant();
        accountant.reserve(BigInteger.valueOf(100));
        accountant.allocate(BigInteger.valueOf(1000), BigInteger.valueOf(10));
        assertEquals(BigInteger.valueOf(90), accountant.getTotalFreeRewards());
        assertEquals(BigInteger.valueOf(1010), accountant.getTotalStakedAndReward());

        accountant.payout(BigInteger.valueOf(1010));
        accountant.release(BigInteger.valueOf(90));
        assertEquals(BigInteger.ZERO, accountant.getTotalFreeRewards());
        assertEquals(BigInteger.ZERO, accountant.getTotalStakedAndReward());
    }

    @Test
    void negativeCounterIsInvariantViolation() {
        RewardAccountant accountant = new RewardAccountant();
        accountant.reserve(BigInteger.TEN);
        assertThrows(IllegalStateException.class, () -> accountant.release(BigInteger.valueOf(11)));
        assertThrows(IllegalStateException.class, () -> accountant.payout(BigInteger.ONE));
        assertEquals(BigInteger.TEN, accountant.getTotalFreeRewards());
    }

    @Test
    void restoreSnapshot() {
        RewardAccountant accountant = new RewardAccountant();
        accountant.reserve(BigInteger.valueOf(50));
        RewardAccountant.Snapshot snapshot = accountant.snapshot();
        accountant.allocate(BigInteger.valueOf(200), BigInteger.valueOf(20));
        accountant.restore(snapshot);
        assertEquals(BigInteger.valueOf(50), accountant.getTotalFreeRewards());
        assertEquals(BigInteger.ZERO, accountant.getTotalStakedAndReward());
    }
}
