package com.bit.locker.stake.impl;

import com.bit.locker.common.Address;
import com.bit.locker.common.PoolHash;
import com.bit.locker.event.EventPublisher;
import com.bit.locker.exception.ErrorType;
import com.bit.locker.exception.LedgerException;
import com.bit.locker.owner.Administration;
import com.bit.locker.stake.StakeService;
import com.bit.locker.stake.pool.PoolRegistry;
import com.bit.locker.stake.position.PositionLedger;
import com.bit.locker.stake.reward.RewardAccountant;
import com.bit.locker.structure.event.DepositEvent;
import com.bit.locker.structure.event.WithdrawEvent;
import com.bit.locker.structure.stake.BridgeTarget;
import com.bit.locker.structure.stake.Pool;
import com.bit.locker.structure.stake.Position;
import com.bit.locker.token.TokenLedger;
import lombok.extern.slf4j.Slf4j;

import java.math.BigInteger;
import java.time.Clock;
import java.util.List;
import java.util.OptionalInt;

/**
 * 质押账本实现
 * 调用严格串行（方法级同步）；顺序约定：校验 -> 拉取 -> 记账，或 校验 -> 记账 -> 推送（失败回滚快照）
 */
@Slf4j
public class StakeServiceImpl implements StakeService {

    private final Address self;
    private final TokenLedger token;
    private final Address vestingAddress;
    private final Administration administration;
    private final EventPublisher events;
    private final Clock clock;

    private final PoolRegistry registry = new PoolRegistry();
    private final PositionLedger positions = new PositionLedger();
    private final RewardAccountant accountant = new RewardAccountant();

    private BridgeTarget bridgeTarget;

    public StakeServiceImpl(Address self, TokenLedger token, Address vestingAddress,
                            Administration administration, EventPublisher events, Clock clock) {
        this.self = self;
        this.token = token;
        this.vestingAddress = vestingAddress;
        this.administration = administration;
        this.events = events;
        this.clock = clock;
    }

    @Override
    public Address address() {
        return self;
    }

    @Override
    public Address tokenAddress() {
        return token.address();
    }

    @Override
    public Address vestingAddress() {
        return vestingAddress;
    }

    @Override
    public synchronized Pool createPool(Address caller, BigInteger minStake, BigInteger maxStake, long startTime,
                                        long endTime, long rewardPermill, long lockPeriod, BigInteger maxTotalStaked) {
        requireAdministrator(caller);
        Pool pool = PoolRegistry.validate(minStake, maxStake, startTime, endTime, rewardPermill, lockPeriod, maxTotalStaked);
        BigInteger reward = Pool.rewardFor(maxTotalStaked, rewardPermill);

        pull(caller, reward);
        int index = registry.append(pool);
        accountant.reserve(reward);
        log.info("建池成功 下标={} hash={} 储备奖励={}", index, pool.getPoolHash(), reward);
        return pool.copy();
    }

    @Override
    public synchronized BigInteger reclaimExpiredPools(Address caller) {
        requireAdministrator(caller);
        long now = now();
        int expired = registry.expiredCount(now);
        BigInteger amount = registry.expiredReserve(now);
        if (expired == 0 || amount.signum() == 0) {
            throw new LedgerException(ErrorType.NOTHING_TO_RECLAIM, "过期池=" + expired);
        }

        List<Pool> poolsBefore = registry.snapshot();
        RewardAccountant.Snapshot countersBefore = accountant.snapshot();
        BigInteger released = registry.removeExpired(now);
        accountant.release(released);
        push(caller, released, () -> {
            registry.restore(poolsBefore);
            accountant.restore(countersBefore);
        });
        log.info("回收过期池 {} 个，退回储备 {}", expired, released);
        return released;
    }

    @Override
    public synchronized Position deposit(Address caller, int poolId, BigInteger amount) {
        return depositFrom(caller, caller, poolId, amount);
    }

    @Override
    public synchronized BigInteger claimAll(Address caller) {
        long now = now();
        List<Position> before = positions.snapshot(caller);
        RewardAccountant.Snapshot countersBefore = accountant.snapshot();

        BigInteger sum = positions.claimMatured(caller, now);
        accountant.payout(sum);
        push(caller, sum, () -> {
            positions.restore(caller, before);
            accountant.restore(countersBefore);
        });
        events.publish(new WithdrawEvent(caller, sum));
        return sum;
    }

    @Override
    public synchronized BigInteger claimOne(Address caller, int index) {
        long now = now();
        List<Position> before = positions.snapshot(caller);
        RewardAccountant.Snapshot countersBefore = accountant.snapshot();

        BigInteger amount = positions.claimAt(caller, index, now);
        accountant.payout(amount);
        push(caller, amount, () -> {
            positions.restore(caller, before);
            accountant.restore(countersBefore);
        });
        events.publish(new WithdrawEvent(caller, amount));
        return amount;
    }

    @Override
    public synchronized Position claim2stake(Address caller, Address user, BigInteger amount) {
        if (caller == null || !caller.equals(vestingAddress)) {
            throw new LedgerException(ErrorType.ONLY_VESTING_CONTRACT, "caller=" + caller);
        }
        if (bridgeTarget == null) {
            throw new LedgerException(ErrorType.BRIDGE_POOL_NOT_SET);
        }
        // 池被回收重排后下标可能指向别的池，必须报错而不是存错池
        if (!registry.matches(bridgeTarget.getPoolIndex(), bridgeTarget.getPoolHash())) {
            throw new LedgerException(ErrorType.POOL_HASH_MISMATCH,
                    "index=" + bridgeTarget.getPoolIndex() + ", expected=" + bridgeTarget.getPoolHash());
        }
        return depositFrom(user, vestingAddress, bridgeTarget.getPoolIndex(), amount);
    }

    @Override
    public synchronized BridgeTarget updateBridgePool(Address caller, int poolIndex) {
        requireAdministrator(caller);
        Pool pool = registry.get(poolIndex);
        bridgeTarget = new BridgeTarget(poolIndex, pool.getPoolHash());
        log.info("代存目标池更新为 下标={} hash={}", poolIndex, pool.getPoolHash());
        return bridgeTarget;
    }

    @Override
    public synchronized boolean isBridgeConfigured() {
        return bridgeTarget != null;
    }

    @Override
    public synchronized BridgeTarget bridgeTarget() {
        return bridgeTarget;
    }

    @Override
    public synchronized int getPoolCount() {
        return registry.size();
    }

    @Override
    public synchronized Pool poolInfo(int index) {
        return registry.copyOf(index);
    }

    @Override
    public synchronized List<Pool> getPools() {
        return registry.copies();
    }

    @Override
    public synchronized OptionalInt poolIndexOf(PoolHash poolHash) {
        return registry.indexOf(poolHash);
    }

    @Override
    public synchronized BigInteger rewardsAvailable() {
        return accountant.getTotalFreeRewards();
    }

    @Override
    public synchronized BigInteger totalStakedTokens() {
        return accountant.getTotalStakedAndReward();
    }

    @Override
    public synchronized List<Position> getUserStakes(Address user) {
        return positions.positionsOf(user);
    }

    @Override
    public synchronized int getUserStakeCount(Address user) {
        return positions.count(user);
    }

    @Override
    public synchronized BigInteger stakedWithRewards(Address user) {
        return positions.total(user);
    }

    @Override
    public synchronized BigInteger claimable(Address user) {
        return positions.matured(user, now());
    }

    @Override
    public synchronized BigInteger userPoolStake(PoolHash poolHash, Address user) {
        return positions.poolBalance(poolHash, user);
    }

    /**
     * 存入公共路径：user 获得仓位，payer 支付本金
     */
    private Position depositFrom(Address user, Address payer, int poolId, BigInteger amount) {
        Pool pool = registry.get(poolId);
        long now = now();
        if (now <= pool.getStartTime()) {
            throw new LedgerException(ErrorType.POOL_NOT_YET_OPEN, "startTime=" + pool.getStartTime());
        }
        if (now >= pool.getEndTime()) {
            throw new LedgerException(ErrorType.ALREADY_CLOSED, "endTime=" + pool.getEndTime());
        }
        if (amount == null || amount.signum() <= 0) {
            throw new LedgerException(ErrorType.ZERO_AMOUNT);
        }
        if (pool.getTotalStaked().add(amount).compareTo(pool.getMaxTotalStaked()) > 0) {
            throw new LedgerException(ErrorType.POOL_IS_FULL,
                    "totalStaked=" + pool.getTotalStaked() + ", maxTotalStaked=" + pool.getMaxTotalStaked());
        }
        BigInteger userStake = positions.poolBalance(pool.getPoolHash(), user).add(amount);
        if (userStake.compareTo(pool.getMinStake()) < 0) {
            throw new LedgerException(ErrorType.POOL_MIN_STAKE, "userStake=" + userStake);
        }
        if (userStake.compareTo(pool.getMaxStake()) > 0) {
            throw new LedgerException(ErrorType.POOL_MAX_STAKE, "userStake=" + userStake);
        }

        BigInteger reward = Pool.rewardFor(amount, pool.getRewardPermill());
        long unlockTime = Math.addExact(now, pool.getLockPeriod());

        // 奖励已在建池时预存，这里只拉本金
        pull(payer, amount);
        pool.addStaked(amount);
        Position position = positions.open(user, pool.getPoolHash(), amount, reward, unlockTime);
        accountant.allocate(amount, reward);

        log.info("存入 user={} pool={} amount={} reward={} unlock={}", user, poolId, amount, reward, unlockTime);
        events.publish(new DepositEvent(user, poolId, amount, unlockTime));
        return position;
    }

    private void pull(Address from, BigInteger amount) {
        if (amount.signum() == 0) {
            return;
        }
        if (!token.transferFrom(self, from, self, amount)) {
            throw new LedgerException(ErrorType.TRANSFER_FAILED, "拉取 " + amount + " 自 " + from);
        }
    }

    /**
     * 推送作为最后一步；失败（返回 false 或抛出）时执行回滚并拒绝整个操作
     */
    private void push(Address to, BigInteger amount, Runnable rollback) {
        boolean ok;
        try {
            ok = token.transfer(self, to, amount);
        } catch (RuntimeException e) {
            log.warn("推送 {} 至 {} 异常，回滚", amount, to, e);
            rollback.run();
            throw e;
        }
        if (!ok) {
            log.warn("推送 {} 至 {} 被拒绝，回滚", amount, to);
            rollback.run();
            throw new LedgerException(ErrorType.TRANSFER_FAILED, "推送 " + amount + " 至 " + to);
        }
    }

    private void requireAdministrator(Address caller) {
        if (!administration.isAdministrator(caller)) {
            throw new LedgerException(ErrorType.ONLY_ADMINISTRATOR, "caller=" + caller);
        }
    }

    private long now() {
        return clock.instant().getEpochSecond();
    }
}
