package com.bit.locker.vesting.impl;

import com.bit.locker.common.Address;
import com.bit.locker.exception.ErrorType;
import com.bit.locker.exception.LedgerException;
import com.bit.locker.structure.event.ClaimedEvent;
import com.bit.locker.structure.event.VestingAddedEvent;
import com.bit.locker.structure.vesting.Vest;
import com.bit.locker.support.FlakyTokenLedger;
import com.bit.locker.support.LedgerFixture;
import com.bit.locker.token.impl.MemoryTokenLedger;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.function.Executable;

import java.math.BigInteger;

import static com.bit.locker.support.LedgerFixture.DAY;
import static com.bit.locker.support.LedgerFixture.WEEK;
import static com.bit.locker.support.LedgerFixture.tokens;
import static org.junit.jupiter.api.Assertions.*;

@Slf4j
public class VestingServiceImplTest {

    private static final BigInteger ONE = tokens("1");
    private static final BigInteger TWO = tokens("2");
    private static final BigInteger TEN = tokens("10");

    private LedgerFixture f;
    private Address user1;
    private Address user2;
    private Address user3;
    private Address user4;
    private Address user5;

    @BeforeEach
    void setUp() {
        f = new LedgerFixture(tokens("1000"));
        user1 = LedgerFixture.user(1);
        user2 = LedgerFixture.user(2);
        user3 = LedgerFixture.user(3);
        user4 = LedgerFixture.user(4);
        user5 = LedgerFixture.user(5);
    }

    private static void assertRejected(ErrorType expected, Executable call) {
        LedgerException e = assertThrows(LedgerException.class, call);
        assertEquals(expected, e.getErrorType());
    }

    private ClaimedEvent lastClaim() {
        return f.events.last(ClaimedEvent.class);
    }

    @Test
    void pointsToken() {
        assertEquals(f.tokenAddress, f.vesting.tokenAddress());
        assertEquals(BigInteger.ZERO, f.vesting.vested());
        assertEquals(Address.ZERO, f.vesting.stakeAddress());
    }

    @Test
    void rejectsWrongLockConfig() {
        long t = f.clock.now();
        assertRejected(ErrorType.TRANSFER_FAILED, () -> f.vesting.addLock(f.owner, user1, ONE, TWO, t + DAY, t + WEEK));
        f.approveVesting(f.owner, tokens("100"));
        assertRejected(ErrorType.START_DATE_IN_PAST, () -> f.vesting.addLock(f.owner, user1, ONE, TWO, t - 1, t + WEEK));
        assertRejected(ErrorType.START_DATE_IN_PAST, () -> f.vesting.addLock(f.owner, user1, ONE, TWO, t, t + WEEK));
        assertRejected(ErrorType.ONLY_ADMINISTRATOR, () -> f.vesting.addLock(user1, user1, ONE, TWO, t + DAY, t + WEEK));
        assertRejected(ErrorType.ZERO_AMOUNT,
                () -> f.vesting.addLock(f.owner, user1, BigInteger.ZERO, BigInteger.ZERO, t + DAY, t + WEEK));
        assertRejected(ErrorType.ZERO_ADDRESS, () -> f.vesting.addLock(f.owner, Address.ZERO, ONE, TWO, t + DAY, t + WEEK));
        assertRejected(ErrorType.TIMESTAMPS_MISCONFIGURED,
                () -> f.vesting.addLock(f.owner, user1, ONE, TWO, t + WEEK, t + DAY));
        assertRejected(ErrorType.START_AMOUNT_EXCEEDS_TOTAL,
                () -> f.vesting.addLock(f.owner, user1, TWO, ONE, t + DAY, t + WEEK));

        assertEquals(0, f.vesting.getVestingsCount(user1));
        assertEquals(BigInteger.ZERO, f.token.balanceOf(f.vestingAddress));
    }

    @Test
    void vestAndClaimOverTime() {
        f.approveVesting(f.owner, tokens("100"));
        long t = f.clock.now();

        // user1: 3 个 10 天，2 个 20 天，1.5 个 100 天
        Vest first = f.vesting.addLock(f.owner, user1, ONE, tokens("3"), t + 1, t + DAY * 10);
        VestingAddedEvent added = f.events.last(VestingAddedEvent.class);
        assertEquals(user1, added.getUser());
        assertEquals(ONE, added.getStartAmount());
        assertEquals(tokens("3"), added.getTotalAmount());
        assertEquals(t + 1, added.getStartDate());
        assertEquals(t + DAY * 10, added.getEndDate());
        assertEquals(BigInteger.ZERO, first.getClaimed());

        f.vesting.addLock(f.owner, user1, BigInteger.ZERO, TWO, t + DAY * 10, t + DAY * 30);
        f.vesting.addLock(f.owner, user1, BigInteger.ZERO, tokens("1.5"), t + DAY * 30, t + DAY * 130);
        assertEquals(3, f.vesting.getVestingsCount(user1));
        Vest last = f.vesting.getVesting(user1, 2);
        assertEquals(BigInteger.ZERO, last.getStartAmount());
        assertEquals(tokens("1.5"), last.getTotalAmount());
        assertEquals(t + DAY * 30, last.getStartDate());
        assertEquals(t + DAY * 130, last.getEndDate());
        assertEquals(BigInteger.ZERO, last.getClaimed());

        Address[] users = {user2, user2, user2, user3, user3, user3, user5};
        String[] totals = {"1", "0.8", "0.5", "0.5", "0.5", "0.5", "1"};
        long[] starts = {DAY, DAY * 10, DAY * 30, DAY, DAY * 20, DAY * 60, DAY * 60};
        long[] ends = {DAY * 10, DAY * 30, DAY * 130, DAY * 20, DAY * 60, DAY * 140, DAY * 140};
        for (int i = 0; i < users.length; i++) {
            f.vesting.addLock(f.owner, users[i], BigInteger.ZERO, tokens(totals[i]), t + starts[i], t + ends[i]);
        }
        assertEquals(tokens("11.3"), f.vesting.vested());
        assertTrue(f.vestingConserved());

        // 余额不足
        f.approveVesting(f.owner, MemoryTokenLedger.MAX_UINT256);
        assertRejected(ErrorType.TRANSFER_FAILED,
                () -> f.vesting.addLock(f.owner, user1, BigInteger.ZERO, tokens("1000"), t + DAY * 30, t + DAY * 130));

        assertRejected(ErrorType.NO_LOCKS_FOR_CALLER, () -> f.vesting.claimAll(user4));
        assertRejected(ErrorType.NOTHING_TO_CLAIM, () -> f.vesting.claimAll(user1));

        f.clock.setTo(t + DAY * 5);
        assertEquals(new BigInteger("105263157894736842"), f.vesting.claimAll(user3));
        assertEquals(user3, lastClaim().getUser());
        assertEquals(new BigInteger("105263157894736842"), lastClaim().getAmount());
        assertRejected(ErrorType.NOTHING_TO_CLAIM, () -> f.vesting.claimAll(user3));

        // 第一个授予结束，第二个过半
        f.clock.setTo(t + DAY * 20);
        assertEquals(tokens("1.4"), f.vesting.claimable(user2));
        assertEquals(tokens("1.4"), f.vesting.claimAll(user2));

        f.clock.setTo(t + DAY * 140 + 10);
        assertEquals(tokens("6.5"), f.vesting.claimAll(user1));
        assertEquals(tokens("0.9"), f.vesting.claimAll(user2));
        assertEquals(new BigInteger("1394736842105263158"), f.vesting.claimAll(user3));
        assertEquals(ONE, f.vesting.claimAll(user5));
        assertEquals(user5, lastClaim().getUser());

        assertEquals(tokens("6.5"), f.token.balanceOf(user1));
        assertEquals(tokens("2.3"), f.token.balanceOf(user2));
        assertEquals(tokens("1.5"), f.token.balanceOf(user3));
        assertEquals(BigInteger.ZERO, f.vesting.vested());
        assertTrue(f.vestingConserved());
        // 领完的授予仍保留
        assertEquals(3, f.vesting.getVestingsCount(user1));
        assertRejected(ErrorType.NOTHING_TO_CLAIM, () -> f.vesting.claimAll(user1));
    }

    @Test
    void looksLikeErc20() {
        assertEquals("vested Mateico", f.vesting.name());
        assertEquals("vMATE", f.vesting.symbol());
        assertEquals(18, f.vesting.decimals());

        f.approveVesting(f.owner, tokens("100"));
        long t = f.clock.now();
        f.vesting.addLock(f.owner, user1, BigInteger.ZERO, TEN, t + DAY, t + WEEK);
        assertEquals(TEN, f.vesting.balanceOf(user1));
        assertEquals(TEN, f.vesting.totalSupply());

        // transfer 只触发领取，接收方与数量被忽略
        f.clock.setTo(t + DAY * 4);
        assertEquals(tokens("5"), f.vesting.transfer(user1, user2, ONE));
        assertEquals(user1, lastClaim().getUser());
        assertEquals(tokens("5"), lastClaim().getAmount());
        assertEquals(tokens("5"), f.vesting.balanceOf(user1));
        assertEquals(tokens("5"), f.vesting.totalSupply());
        assertEquals(tokens("5"), f.token.balanceOf(user1));
        assertEquals(BigInteger.ZERO, f.token.balanceOf(user2));
    }

    @Test
    void rejectedPushRollsBack() {
        FlakyTokenLedger flaky = new FlakyTokenLedger(f.tokenAddress, f.owner, tokens("1000"));
        LedgerFixture g = new LedgerFixture(null, flaky);
        long t = g.clock.now();
        g.approveVesting(g.owner, tokens("100"));
        g.vesting.addLock(g.owner, user1, BigInteger.ZERO, TEN, t + DAY, t + WEEK);
        g.clock.setTo(t + WEEK);

        flaky.setMode(FlakyTokenLedger.Mode.REJECT);
        assertRejected(ErrorType.TRANSFER_FAILED, () -> g.vesting.claimAll(user1));
        flaky.setMode(FlakyTokenLedger.Mode.THROW);
        assertThrows(IllegalStateException.class, () -> g.vesting.claimAll(user1));

        assertEquals(TEN, g.vesting.vested());
        assertEquals(BigInteger.ZERO, g.vesting.getVesting(user1, 0).getClaimed());
        assertTrue(g.events.eventsOf(ClaimedEvent.class).isEmpty());

        flaky.setMode(FlakyTokenLedger.Mode.NORMAL);
        assertEquals(TEN, g.vesting.claimAll(user1));
        assertTrue(g.vestingConserved());
    }
}
