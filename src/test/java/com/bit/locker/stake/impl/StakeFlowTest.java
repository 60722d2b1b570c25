package com.bit.locker.stake.impl;

import com.bit.locker.common.Address;
import com.bit.locker.exception.ErrorType;
import com.bit.locker.exception.LedgerException;
import com.bit.locker.structure.event.WithdrawEvent;
import com.bit.locker.structure.stake.Pool;
import com.bit.locker.structure.stake.Position;
import com.bit.locker.support.LedgerFixture;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.List;

import static com.bit.locker.support.LedgerFixture.DAY;
import static com.bit.locker.support.LedgerFixture.WEEK;
import static com.bit.locker.support.LedgerFixture.tokens;
import static org.junit.jupiter.api.Assertions.*;

/**
 * 多用户多池完整流程：存入、过期回收、单个领取、全部领取、回收后领取
 */
@Slf4j
public class StakeFlowTest {

    private static final BigInteger ONE = tokens("1");
    private static final BigInteger TWO = tokens("2");
    private static final BigInteger TEN = tokens("10");
    private static final BigInteger HUNDRED = tokens("100");
    private static final BigInteger THOUSAND = tokens("1000");

    @Test
    void fourPoolsThreeUsers() {
        LedgerFixture f = new LedgerFixture(tokens("1000000"));
        Address user1 = LedgerFixture.user(1);
        Address user2 = LedgerFixture.user(2);
        Address user3 = LedgerFixture.user(3);
        long t0 = f.clock.now();
        f.approveStake(f.owner);

        // 建池
        BigInteger[] min = {ONE, ONE, ONE, TWO};
        BigInteger[] max = {TEN, TEN, TEN, HUNDRED};
        long[] start = {t0 + DAY, t0 + WEEK, t0 + DAY, t0 + WEEK};
        long[] end = {t0 + 2 * WEEK, t0 + WEEK + DAY, t0 + 2 * DAY, t0 + WEEK + DAY};
        long[] permill = {10, 20, 1, 500};
        long[] period = {WEEK + 2 * DAY, WEEK, DAY, 2 * WEEK};
        for (int i = 0; i < 4; i++) {
            f.stake.createPool(f.owner, min[i], max[i], start[i], end[i], permill[i], period[i], THOUSAND);
        }
        assertEquals(4, f.stake.getPools().size());
        assertEquals(1, f.stake.getPools().get(2).getRewardPermill());
        assertEquals(tokens("531"), f.stake.rewardsAvailable());

        // 存入
        for (Address user : new Address[]{user1, user2, user3}) {
            f.fund(user, THOUSAND);
            f.approveStake(user);
        }
        f.clock.setTo(t0 + DAY + 1); // 池0、池2开放
        f.stake.deposit(user1, 0, TEN);
        f.stake.deposit(user1, 2, TEN);
        f.stake.deposit(user2, 0, TWO);
        f.stake.deposit(user3, 2, TEN);
        f.stake.deposit(user2, 2, TWO);
        f.clock.setTo(t0 + WEEK + 1); // 池1、池3开放，池2关闭
        LedgerException closed = assertThrows(LedgerException.class, () -> f.stake.deposit(user1, 2, TWO));
        assertEquals("Already closed", closed.getErrorType().getDesc());
        f.stake.deposit(user2, 1, TWO);
        f.stake.deposit(user2, 3, TEN);
        f.stake.deposit(user3, 1, TWO);
        f.stake.deposit(user3, 3, TEN);
        f.stake.deposit(user3, 3, TWO);
        assertTrue(f.stakeConserved());

        // 读取
        List<Pool> pools = f.stake.getPools();
        assertEquals(tokens("12"), pools.get(0).getTotalStaked());
        assertEquals(tokens("4"), pools.get(1).getTotalStaked());
        assertEquals(tokens("22"), pools.get(2).getTotalStaked());
        assertEquals(tokens("22"), pools.get(3).getTotalStaked());
        // 531 - (0.12 + 0.08 + 0.022 + 11)
        assertEquals(tokens("519.778"), f.stake.rewardsAvailable());

        assertEquals(2, f.stake.getUserStakeCount(user1));
        assertEquals(4, f.stake.getUserStakeCount(user2));
        assertEquals(4, f.stake.getUserStakeCount(user3));
        for (Address user : new Address[]{user1, user2, user3}) {
            BigInteger sum = BigInteger.ZERO;
            for (Position position : f.stake.getUserStakes(user)) {
                sum = sum.add(position.getTotalAmount());
            }
            assertEquals(sum, f.stake.stakedWithRewards(user));
        }

        // 回收池2：储备1，已用0.022
        BigInteger pre = f.token.balanceOf(f.owner);
        f.stake.reclaimExpiredPools(f.owner);
        assertEquals(tokens("0.978"), f.token.balanceOf(f.owner).subtract(pre));
        assertEquals(3, f.stake.getPoolCount());
        assertEquals(2 * WEEK, f.stake.poolInfo(2).getLockPeriod());
        assertEquals(tokens("518.8"), f.stake.rewardsAvailable());
        assertTrue(f.stakeConserved());

        // user3 的第0个仓位来自池2
        assertEquals(tokens("10.01"), f.stake.claimOne(user3, 0));
        WithdrawEvent withdraw = f.events.last(WithdrawEvent.class);
        assertEquals(user3, withdraw.getUser());
        assertEquals(tokens("10.01"), withdraw.getAmount());

        assertEquals(tokens("10.01"), f.stake.claimable(user1));
        assertEquals(tokens("2.002"), f.stake.claimable(user2));
        assertEquals(BigInteger.ZERO, f.stake.claimable(user3));

        f.clock.setTo(t0 + 2 * WEEK + DAY);
        BigInteger cl1 = f.stake.claimable(user1);
        BigInteger cl2 = f.stake.claimable(user2);
        BigInteger cl3 = f.stake.claimable(user3);
        assertEquals(tokens("20.11"), cl1);
        assertEquals(tokens("6.062"), cl2);
        assertEquals(tokens("2.04"), cl3);
        BigInteger pre1 = f.token.balanceOf(user1);
        BigInteger pre2 = f.token.balanceOf(user2);
        BigInteger pre3 = f.token.balanceOf(user3);
        f.stake.claimAll(user1);
        f.stake.claimAll(user2);
        f.stake.claimAll(user3);
        assertEquals(pre1.add(cl1), f.token.balanceOf(user1));
        assertEquals(pre2.add(cl2), f.token.balanceOf(user2));
        assertEquals(pre3.add(cl3), f.token.balanceOf(user3));
        assertTrue(f.stakeConserved());

        // 仓位移动检查
        f.clock.setTo(t0 + 5 * WEEK);
        assertEquals(0, f.stake.getUserStakes(user1).size());
        List<Position> u2 = f.stake.getUserStakes(user2);
        List<Position> u3 = f.stake.getUserStakes(user3);
        assertEquals(1, u2.size());
        assertEquals(2, u3.size());
        assertEquals(tokens("15"), u2.get(0).getTotalAmount());
        assertEquals(tokens("3"), u3.get(0).getTotalAmount());
        assertEquals(tokens("15"), u3.get(1).getTotalAmount());

        // 全部池过期，回收剩余储备
        BigInteger free = f.stake.rewardsAvailable();
        pre = f.token.balanceOf(f.owner);
        f.stake.reclaimExpiredPools(f.owner);
        assertEquals(free, f.token.balanceOf(f.owner).subtract(pre));
        assertEquals(0, f.stake.getPools().size());
        assertEquals(BigInteger.ZERO, f.stake.rewardsAvailable());

        // 池被回收后仓位仍可领取
        pre1 = f.token.balanceOf(user1);
        pre2 = f.token.balanceOf(user2);
        pre3 = f.token.balanceOf(user3);
        LedgerException none = assertThrows(LedgerException.class, () -> f.stake.claimAll(user1));
        assertEquals(ErrorType.NO_STAKES_FOR_CALLER, none.getErrorType());
        f.stake.claimAll(user2);
        f.stake.claimAll(user3);
        assertEquals(BigInteger.ZERO, f.token.balanceOf(user1).subtract(pre1));
        assertEquals(tokens("15"), f.token.balanceOf(user2).subtract(pre2));
        assertEquals(tokens("18"), f.token.balanceOf(user3).subtract(pre3));

        assertEquals(BigInteger.ZERO, f.stake.totalStakedTokens());
        assertEquals(BigInteger.ZERO, f.token.balanceOf(f.stakeAddress));
        assertTrue(f.stakeConserved());
    }
}
