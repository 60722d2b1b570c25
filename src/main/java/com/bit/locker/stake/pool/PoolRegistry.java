package com.bit.locker.stake.pool;

import com.bit.locker.common.PoolHash;
import com.bit.locker.exception.ErrorType;
import com.bit.locker.exception.LedgerException;
import com.bit.locker.structure.stake.Pool;
import lombok.extern.slf4j.Slf4j;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.OptionalInt;

/**
 * 质押池有序集合
 * 生命周期：创建 -> 接受存入 -> 过期 -> 回收移除
 * 移除采用"末尾元素换入+截断"，下标不稳定，稳定身份只有 poolHash
 */
@Slf4j
public class PoolRegistry {

    private final List<Pool> pools = new ArrayList<>();

    /**
     * 校验参数，返回待追加的池（尚未加入集合）
     */
    public static Pool validate(BigInteger minStake, BigInteger maxStake, long startTime, long endTime,
                                long rewardPermill, long lockPeriod, BigInteger maxTotalStaked) {
        if (minStake == null || maxStake == null || maxTotalStaked == null) {
            throw new LedgerException(ErrorType.ZERO_AMOUNT, "质押限额不能为空");
        }
        if (endTime <= startTime || startTime < 0) {
            throw new LedgerException(ErrorType.TIMESTAMPS_MISCONFIGURED, "startTime=" + startTime + ", endTime=" + endTime);
        }
        if (lockPeriod <= 0 || rewardPermill <= 0) {
            throw new LedgerException(ErrorType.ZERO_AMOUNT, "lockPeriod=" + lockPeriod + ", rewardPermill=" + rewardPermill);
        }
        // 窗口内任何存入的 now + lockPeriod 都不能溢出
        if (endTime > Long.MAX_VALUE - lockPeriod) {
            throw new LedgerException(ErrorType.TIMESTAMPS_MISCONFIGURED, "endTime=" + endTime + ", lockPeriod=" + lockPeriod);
        }
        if (minStake.signum() < 0 || minStake.compareTo(maxStake) >= 0 || maxTotalStaked.compareTo(maxStake) < 0) {
            throw new LedgerException(ErrorType.STAKE_LIMITS_MISCONFIGURED,
                    "min=" + minStake + ", max=" + maxStake + ", maxTotal=" + maxTotalStaked);
        }
        return new Pool(minStake, maxStake, startTime, endTime, rewardPermill, lockPeriod, maxTotalStaked);
    }

    public int append(Pool pool) {
        pools.add(pool);
        return pools.size() - 1;
    }

    public int size() {
        return pools.size();
    }

    /**
     * 内部可变引用，仅供账本自身修改 totalStaked
     */
    public Pool get(int index) {
        if (index < 0 || index >= pools.size()) {
            throw new LedgerException(ErrorType.WRONG_POOL_INDEX, "index=" + index + ", count=" + pools.size());
        }
        return pools.get(index);
    }

    public Pool copyOf(int index) {
        return get(index).copy();
    }

    public List<Pool> copies() {
        List<Pool> result = new ArrayList<>(pools.size());
        for (Pool pool : pools) {
            result.add(pool.copy());
        }
        return result;
    }

    public OptionalInt indexOf(PoolHash poolHash) {
        for (int i = 0; i < pools.size(); i++) {
            if (pools.get(i).getPoolHash().equals(poolHash)) {
                return OptionalInt.of(i);
            }
        }
        return OptionalInt.empty();
    }

    /**
     * 当前下标上的池是否仍是记住的那个
     */
    public boolean matches(int index, PoolHash poolHash) {
        return index >= 0 && index < pools.size() && pools.get(index).getPoolHash().equals(poolHash);
    }

    /**
     * 已过期池的未用储备之和（纯读）
     */
    public BigInteger expiredReserve(long now) {
        BigInteger total = BigInteger.ZERO;
        for (Pool pool : pools) {
            if (pool.isClosed(now)) {
                total = total.add(pool.unusedReserve());
            }
        }
        return total;
    }

    public int expiredCount(long now) {
        int count = 0;
        for (Pool pool : pools) {
            if (pool.isClosed(now)) {
                count++;
            }
        }
        return count;
    }

    /**
     * 单趟移除全部过期池，返回释放的储备
     * 命中时把末尾元素换入当前位置并截断，游标不前进，重新检查换入的元素
     */
    public BigInteger removeExpired(long now) {
        BigInteger released = BigInteger.ZERO;
        int i = 0;
        while (i < pools.size()) {
            Pool pool = pools.get(i);
            if (pool.isClosed(now)) {
                released = released.add(pool.unusedReserve());
                int last = pools.size() - 1;
                pools.set(i, pools.get(last));
                pools.remove(last);
                log.info("移除过期池 {} (下标 {})", pool.getPoolHash(), i);
            } else {
                i++;
            }
        }
        return released;
    }

    public List<Pool> snapshot() {
        return copies();
    }

    public void restore(List<Pool> snapshot) {
        pools.clear();
        for (Pool pool : snapshot) {
            pools.add(pool.copy());
        }
    }
}
