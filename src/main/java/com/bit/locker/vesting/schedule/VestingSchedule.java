package com.bit.locker.vesting.schedule;

import com.bit.locker.common.Address;
import com.bit.locker.exception.ErrorType;
import com.bit.locker.exception.LedgerException;
import com.bit.locker.structure.vesting.Vest;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 用户线性释放授予集合，以及托管总量 vestedTotal
 * 授予领取完也不删除，之后可领取量恒为0
 */
public class VestingSchedule {

    // 定点比例精度 1e18
    public static final BigInteger SCALE = BigInteger.TEN.pow(18);

    private final Map<Address, List<Vest>> vests = new HashMap<>();

    private BigInteger vestedTotal = BigInteger.ZERO;

    /**
     * now 时刻该授予还可领取的数量
     * 整数除法向零截断，舍入永远偏向少放
     */
    public static BigInteger claimableAt(Vest vest, long now) {
        if (now <= vest.getStartDate()) {
            return BigInteger.ZERO;
        }
        if (now >= vest.getEndDate()) {
            return vest.getTotalAmount().subtract(vest.getClaimed());
        }
        BigInteger ratio = BigInteger.valueOf(now - vest.getStartDate())
                .multiply(SCALE)
                .divide(BigInteger.valueOf(vest.getEndDate() - vest.getStartDate()));
        BigInteger released = vest.getStartAmount().add(
                vest.getTotalAmount().subtract(vest.getStartAmount()).multiply(ratio).divide(SCALE));
        BigInteger claimable = released.subtract(vest.getClaimed());
        return claimable.signum() > 0 ? claimable : BigInteger.ZERO;
    }

    public Vest add(Address user, BigInteger startAmount, BigInteger totalAmount, long startDate, long endDate) {
        Vest vest = new Vest(startAmount, totalAmount, startDate, endDate);
        vests.computeIfAbsent(user, k -> new ArrayList<>()).add(vest);
        vestedTotal = vestedTotal.add(totalAmount);
        return vest;
    }

    /**
     * 把每个授予的 claimed 推进到当前可领取位置，返回总和
     */
    public BigInteger claim(Address user, long now) {
        List<Vest> list = vests.get(user);
        if (list == null || list.isEmpty()) {
            throw new LedgerException(ErrorType.NO_LOCKS_FOR_CALLER);
        }
        BigInteger sum = BigInteger.ZERO;
        for (Vest vest : list) {
            BigInteger amount = claimableAt(vest, now);
            if (amount.signum() > 0) {
                vest.addClaimed(amount);
                sum = sum.add(amount);
            }
        }
        if (sum.signum() == 0) {
            throw new LedgerException(ErrorType.NOTHING_TO_CLAIM);
        }
        vestedTotal = vestedTotal.subtract(sum);
        return sum;
    }

    public BigInteger claimable(Address user, long now) {
        BigInteger sum = BigInteger.ZERO;
        for (Vest vest : vests.getOrDefault(user, Collections.emptyList())) {
            sum = sum.add(claimableAt(vest, now));
        }
        return sum;
    }

    // 尚未领取的剩余总额
    public BigInteger unclaimed(Address user) {
        BigInteger sum = BigInteger.ZERO;
        for (Vest vest : vests.getOrDefault(user, Collections.emptyList())) {
            sum = sum.add(vest.unclaimed());
        }
        return sum;
    }

    public int count(Address user) {
        return vests.getOrDefault(user, Collections.emptyList()).size();
    }

    public Vest copyOf(Address user, int index) {
        List<Vest> list = vests.getOrDefault(user, Collections.emptyList());
        if (index < 0 || index >= list.size()) {
            throw new LedgerException(ErrorType.WRONG_VEST_INDEX, "index=" + index + ", count=" + list.size());
        }
        return list.get(index).copy();
    }

    public List<Vest> copies(Address user) {
        List<Vest> result = new ArrayList<>();
        for (Vest vest : vests.getOrDefault(user, Collections.emptyList())) {
            result.add(vest.copy());
        }
        return result;
    }

    public BigInteger getVestedTotal() {
        return vestedTotal;
    }

    public Snapshot snapshot(Address user) {
        return new Snapshot(user, copies(user), vestedTotal);
    }

    public void restore(Snapshot snapshot) {
        List<Vest> restored = new ArrayList<>();
        for (Vest vest : snapshot.vests) {
            restored.add(vest.copy());
        }
        vests.put(snapshot.user, restored);
        vestedTotal = snapshot.vestedTotal;
    }

    public static final class Snapshot {
        private final Address user;
        private final List<Vest> vests;
        private final BigInteger vestedTotal;

        private Snapshot(Address user, List<Vest> vests, BigInteger vestedTotal) {
            this.user = user;
            this.vests = vests;
            this.vestedTotal = vestedTotal;
        }
    }
}
