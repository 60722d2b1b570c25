package com.bit.locker.structure.stake;

import com.bit.locker.common.PoolHash;
import lombok.Getter;
import lombok.ToString;

import java.math.BigInteger;

/**
 * 质押池：一份质押报价
 * 创建后参数不变，只有 totalStaked 随存入增长
 */
@Getter
@ToString
public class Pool {

    /**
     * 单用户累计质押下限/上限
     */
    private final BigInteger minStake;
    private final BigInteger maxStake;

    /**
     * 接受存入的时间窗口（秒），开区间 (startTime, endTime)
     */
    private final long startTime;
    private final long endTime;

    /**
     * 每1000单位本金的奖励
     */
    private final long rewardPermill;

    /**
     * 存入到解锁的时长（秒）
     */
    private final long lockPeriod;

    /**
     * 池容量（本金）
     */
    private final BigInteger maxTotalStaked;

    private BigInteger totalStaked;

    private final PoolHash poolHash;

    public Pool(BigInteger minStake, BigInteger maxStake, long startTime, long endTime,
                long rewardPermill, long lockPeriod, BigInteger maxTotalStaked) {
        this(minStake, maxStake, startTime, endTime, rewardPermill, lockPeriod, maxTotalStaked, BigInteger.ZERO,
                PoolHash.of(minStake, maxStake, startTime, endTime, rewardPermill, lockPeriod, maxTotalStaked));
    }

    private Pool(BigInteger minStake, BigInteger maxStake, long startTime, long endTime, long rewardPermill,
                 long lockPeriod, BigInteger maxTotalStaked, BigInteger totalStaked, PoolHash poolHash) {
        this.minStake = minStake;
        this.maxStake = maxStake;
        this.startTime = startTime;
        this.endTime = endTime;
        this.rewardPermill = rewardPermill;
        this.lockPeriod = lockPeriod;
        this.maxTotalStaked = maxTotalStaked;
        this.totalStaked = totalStaked;
        this.poolHash = poolHash;
    }

    public void addStaked(BigInteger amount) {
        BigInteger next = totalStaked.add(amount);
        if (next.compareTo(maxTotalStaked) > 0) {
            throw new IllegalStateException("池质押量超出容量 " + next + " > " + maxTotalStaked);
        }
        totalStaked = next;
    }

    public boolean isClosed(long now) {
        return now >= endTime;
    }

    /**
     * 未被存入占用的奖励储备
     */
    public BigInteger unusedReserve() {
        return rewardFor(maxTotalStaked.subtract(totalStaked), rewardPermill);
    }

    public static BigInteger rewardFor(BigInteger amount, long rewardPermill) {
        return amount.multiply(BigInteger.valueOf(rewardPermill)).divide(BigInteger.valueOf(1000));
    }

    public Pool copy() {
        return new Pool(minStake, maxStake, startTime, endTime, rewardPermill, lockPeriod, maxTotalStaked,
                totalStaked, poolHash);
    }
}
