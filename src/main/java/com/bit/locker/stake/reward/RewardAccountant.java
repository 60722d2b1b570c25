package com.bit.locker.stake.reward;

import lombok.extern.slf4j.Slf4j;

import java.math.BigInteger;

/**
 * 奖励记账：
 * totalFreeRewards  已储备、尚未分配给仓位的奖励
 * totalStakedAndReward 全部未领取仓位的本金+奖励
 * 建池时 +reward，之后恰好一次 -reward（存入分配 或 回收释放）
 */
@Slf4j
public class RewardAccountant {

    private BigInteger totalFreeRewards = BigInteger.ZERO;

    private BigInteger totalStakedAndReward = BigInteger.ZERO;

    public BigInteger getTotalFreeRewards() {
        return totalFreeRewards;
    }

    public BigInteger getTotalStakedAndReward() {
        return totalStakedAndReward;
    }

    // 建池储备
    public void reserve(BigInteger reward) {
        requireNonNegative(reward);
        totalFreeRewards = totalFreeRewards.add(reward);
    }

    // 存入：储备中的 reward 转为仓位的一部分
    public void allocate(BigInteger principal, BigInteger reward) {
        requireNonNegative(principal);
        requireNonNegative(reward);
        totalFreeRewards = decrease(totalFreeRewards, reward, "totalFreeRewards");
        totalStakedAndReward = totalStakedAndReward.add(principal).add(reward);
    }

    // 回收过期池未用储备
    public void release(BigInteger unused) {
        requireNonNegative(unused);
        totalFreeRewards = decrease(totalFreeRewards, unused, "totalFreeRewards");
    }

    // 仓位领取
    public void payout(BigInteger amount) {
        requireNonNegative(amount);
        totalStakedAndReward = decrease(totalStakedAndReward, amount, "totalStakedAndReward");
    }

    public Snapshot snapshot() {
        return new Snapshot(totalFreeRewards, totalStakedAndReward);
    }

    public void restore(Snapshot snapshot) {
        totalFreeRewards = snapshot.totalFreeRewards;
        totalStakedAndReward = snapshot.totalStakedAndReward;
    }

    private static BigInteger decrease(BigInteger current, BigInteger amount, String counter) {
        BigInteger next = current.subtract(amount);
        if (next.signum() < 0) {
            log.error("记账不变量被破坏: {} = {} - {}", counter, current, amount);
            throw new IllegalStateException(counter + " 不能为负: " + current + " - " + amount);
        }
        return next;
    }

    private static void requireNonNegative(BigInteger amount) {
        if (amount.signum() < 0) {
            throw new IllegalArgumentException("金额不能为负: " + amount);
        }
    }

    public static final class Snapshot {
        private final BigInteger totalFreeRewards;
        private final BigInteger totalStakedAndReward;

        private Snapshot(BigInteger totalFreeRewards, BigInteger totalStakedAndReward) {
            this.totalFreeRewards = totalFreeRewards;
            this.totalStakedAndReward = totalStakedAndReward;
        }
    }
}
