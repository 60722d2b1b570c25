package com.bit.locker.vesting.impl;

import com.bit.locker.common.Address;
import com.bit.locker.event.EventPublisher;
import com.bit.locker.exception.ErrorType;
import com.bit.locker.exception.LedgerException;
import com.bit.locker.owner.Administration;
import com.bit.locker.stake.StakeService;
import com.bit.locker.structure.event.ClaimedEvent;
import com.bit.locker.structure.event.VestingAddedEvent;
import com.bit.locker.structure.vesting.Vest;
import com.bit.locker.token.TokenLedger;
import com.bit.locker.token.impl.MemoryTokenLedger;
import com.bit.locker.vesting.VestingService;
import com.bit.locker.vesting.schedule.VestingSchedule;
import lombok.extern.slf4j.Slf4j;

import java.math.BigInteger;
import java.time.Clock;
import java.util.List;

@Slf4j
public class VestingServiceImpl implements VestingService {

    private static final int DECIMALS = 18;

    private final Address self;
    private final TokenLedger token;
    private final Administration administration;
    private final EventPublisher events;
    private final Clock clock;

    private final VestingSchedule schedule = new VestingSchedule();

    private StakeService stakeService;

    public VestingServiceImpl(Address self, TokenLedger token, Administration administration,
                              EventPublisher events, Clock clock) {
        this.self = self;
        this.token = token;
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
    public synchronized Vest addLock(Address caller, Address beneficiary, BigInteger startAmount, BigInteger totalAmount,
                                     long startDate, long endDate) {
        if (!administration.isAdministrator(caller)) {
            throw new LedgerException(ErrorType.ONLY_ADMINISTRATOR, "caller=" + caller);
        }
        if (totalAmount == null || totalAmount.signum() <= 0) {
            throw new LedgerException(ErrorType.ZERO_AMOUNT);
        }
        if (beneficiary == null || beneficiary.isZero()) {
            throw new LedgerException(ErrorType.ZERO_ADDRESS);
        }
        long now = now();
        if (startDate <= now) {
            throw new LedgerException(ErrorType.START_DATE_IN_PAST, "startDate=" + startDate + ", now=" + now);
        }
        if (endDate <= startDate) {
            throw new LedgerException(ErrorType.TIMESTAMPS_MISCONFIGURED, "startDate=" + startDate + ", endDate=" + endDate);
        }
        BigInteger start = startAmount == null ? BigInteger.ZERO : startAmount;
        if (start.signum() < 0 || start.compareTo(totalAmount) > 0) {
            throw new LedgerException(ErrorType.START_AMOUNT_EXCEEDS_TOTAL, "startAmount=" + start);
        }

        // 先拉取托管资金，失败则不产生任何状态
        if (!token.transferFrom(self, caller, self, totalAmount)) {
            throw new LedgerException(ErrorType.TRANSFER_FAILED, "拉取 " + totalAmount + " 自 " + caller);
        }
        Vest vest = schedule.add(beneficiary, start, totalAmount, startDate, endDate);
        log.info("新增授予 user={} total={} [{}, {}]", beneficiary, totalAmount, startDate, endDate);
        events.publish(new VestingAddedEvent(beneficiary, start, totalAmount, startDate, endDate));
        return vest.copy();
    }

    @Override
    public synchronized BigInteger claimAll(Address caller) {
        VestingSchedule.Snapshot before = schedule.snapshot(caller);
        BigInteger sum = schedule.claim(caller, now());

        boolean ok;
        try {
            ok = token.transfer(self, caller, sum);
        } catch (RuntimeException e) {
            log.warn("领取推送 {} 至 {} 异常，回滚", sum, caller, e);
            schedule.restore(before);
            throw e;
        }
        if (!ok) {
            log.warn("领取推送 {} 至 {} 被拒绝，回滚", sum, caller);
            schedule.restore(before);
            throw new LedgerException(ErrorType.TRANSFER_FAILED, "推送 " + sum + " 至 " + caller);
        }
        log.info("领取 user={} amount={}", caller, sum);
        events.publish(new ClaimedEvent(caller, sum));
        return sum;
    }

    @Override
    public synchronized BigInteger claim2stake(Address caller) {
        if (stakeService == null) {
            throw new LedgerException(ErrorType.STAKE_CONTRACT_NOT_SET);
        }
        VestingSchedule.Snapshot before = schedule.snapshot(caller);
        BigInteger sum = schedule.claim(caller, now());
        try {
            stakeService.claim2stake(self, caller, sum);
        } catch (RuntimeException e) {
            log.warn("代存 {} 被质押账本拒绝，回滚: {}", sum, e.getMessage());
            schedule.restore(before);
            throw e;
        }
        log.info("领取并质押 user={} amount={}", caller, sum);
        events.publish(new ClaimedEvent(caller, sum));
        return sum;
    }

    @Override
    public synchronized void setStakeAddress(Address caller, StakeService target) {
        if (!administration.isAdministrator(caller)) {
            throw new LedgerException(ErrorType.ONLY_ADMINISTRATOR, "caller=" + caller);
        }
        if (stakeService != null) {
            throw new LedgerException(ErrorType.CONTRACT_ALREADY_SET, "stake=" + stakeService.address());
        }
        if (target == null || target.address() == null || target.address().isZero()) {
            throw new LedgerException(ErrorType.ZERO_ADDRESS);
        }
        // 双向确认：对方记录的归属账本必须是自己
        if (!self.equals(target.vestingAddress())) {
            throw new LedgerException(ErrorType.COUNTERPART_MISMATCH,
                    "expected=" + self + ", reported=" + target.vestingAddress());
        }
        if (!token.approve(self, target.address(), MemoryTokenLedger.MAX_UINT256)) {
            throw new LedgerException(ErrorType.TRANSFER_FAILED, "授权质押账本失败");
        }
        stakeService = target;
        log.info("归属账本绑定质押账本 {}", target.address());
    }

    @Override
    public synchronized Address stakeAddress() {
        return stakeService == null ? Address.ZERO : stakeService.address();
    }

    @Override
    public synchronized BigInteger vested() {
        return schedule.getVestedTotal();
    }

    @Override
    public synchronized int getVestingsCount(Address user) {
        return schedule.count(user);
    }

    @Override
    public synchronized Vest getVesting(Address user, int index) {
        return schedule.copyOf(user, index);
    }

    @Override
    public synchronized List<Vest> getVestings(Address user) {
        return schedule.copies(user);
    }

    @Override
    public synchronized BigInteger claimable(Address user) {
        return schedule.claimable(user, now());
    }

    @Override
    public String name() {
        return "vested " + token.name();
    }

    @Override
    public String symbol() {
        return "v" + token.symbol();
    }

    @Override
    public int decimals() {
        return DECIMALS;
    }

    @Override
    public synchronized BigInteger totalSupply() {
        return schedule.getVestedTotal();
    }

    @Override
    public synchronized BigInteger balanceOf(Address user) {
        return schedule.unclaimed(user);
    }

    @Override
    public BigInteger transfer(Address caller, Address to, BigInteger amount) {
        log.debug("transfer 触发领取，忽略参数 to={} amount={}", to, amount);
        return claimAll(caller);
    }

    private long now() {
        return clock.instant().getEpochSecond();
    }
}
