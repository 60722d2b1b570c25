package com.bit.locker.stake;

import com.bit.locker.common.Address;
import com.bit.locker.common.PoolHash;
import com.bit.locker.structure.stake.BridgeTarget;
import com.bit.locker.structure.stake.Pool;
import com.bit.locker.structure.stake.Position;

import java.math.BigInteger;
import java.util.List;
import java.util.OptionalInt;

/**
 * 质押账本
 * 管理员建池并预存奖励储备；用户在窗口期内存入，锁定期满后领取本金+奖励；
 * 过期池由管理员回收未用储备。所有时间相关状态在每次调用时按当前时间重新计算。
 */
public interface StakeService {

    /**
     * 账本自身在代币账本上的地址
     */
    Address address();

    Address tokenAddress();

    /**
     * 唯一允许代存（claim2stake）的归属账本地址
     */
    Address vestingAddress();

    /**
     * 建池：拉取 maxTotalStaked * rewardPermill / 1000 作为奖励储备
     *
     * @return 新池的副本
     */
    Pool createPool(Address caller, BigInteger minStake, BigInteger maxStake, long startTime, long endTime,
                    long rewardPermill, long lockPeriod, BigInteger maxTotalStaked);

    /**
     * 移除所有已过期池，未用储备退回管理员
     *
     * @return 退回数量
     */
    BigInteger reclaimExpiredPools(Address caller);

    Position deposit(Address caller, int poolId, BigInteger amount);

    /**
     * 领取全部到期仓位
     */
    BigInteger claimAll(Address caller);

    /**
     * 领取指定下标的到期仓位
     */
    BigInteger claimOne(Address caller, int index);

    /**
     * 归属账本代用户存入桥接目标池，资金从归属账本拉取
     */
    Position claim2stake(Address caller, Address user, BigInteger amount);

    BridgeTarget updateBridgePool(Address caller, int poolIndex);

    boolean isBridgeConfigured();

    BridgeTarget bridgeTarget();

    int getPoolCount();

    Pool poolInfo(int index);

    List<Pool> getPools();

    OptionalInt poolIndexOf(PoolHash poolHash);

    BigInteger rewardsAvailable();

    BigInteger totalStakedTokens();

    List<Position> getUserStakes(Address user);

    int getUserStakeCount(Address user);

    BigInteger stakedWithRewards(Address user);

    BigInteger claimable(Address user);

    BigInteger userPoolStake(PoolHash poolHash, Address user);
}
