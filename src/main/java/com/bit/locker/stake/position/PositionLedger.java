package com.bit.locker.stake.position;

import com.bit.locker.common.Address;
import com.bit.locker.common.PoolHash;
import com.bit.locker.exception.ErrorType;
import com.bit.locker.exception.LedgerException;
import com.bit.locker.structure.stake.Position;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 用户仓位集合 + (poolHash, user) 累计本金
 * 领取时"末尾换入+截断"删除，仓位顺序在任何领取后都不保证
 */
public class PositionLedger {

    private final Map<Address, List<Position>> positions = new HashMap<>();

    // 只用于单用户上下限校验，与仓位删除无关
    private final Map<PoolHash, Map<Address, BigInteger>> poolBalances = new HashMap<>();

    public BigInteger poolBalance(PoolHash poolHash, Address user) {
        Map<Address, BigInteger> balances = poolBalances.get(poolHash);
        return balances == null ? BigInteger.ZERO : balances.getOrDefault(user, BigInteger.ZERO);
    }

    public Position open(Address user, PoolHash poolHash, BigInteger principal, BigInteger reward, long unlockTime) {
        Position position = new Position(unlockTime, principal.add(reward));
        positions.computeIfAbsent(user, k -> new ArrayList<>()).add(position);
        poolBalances.computeIfAbsent(poolHash, k -> new HashMap<>())
                .merge(user, principal, BigInteger::add);
        return position;
    }

    /**
     * 领取全部到期仓位，单趟线性扫描
     */
    public BigInteger claimMatured(Address user, long now) {
        List<Position> list = requirePositions(user);
        BigInteger sum = BigInteger.ZERO;
        int i = 0;
        while (i < list.size()) {
            Position position = list.get(i);
            if (position.isMatured(now)) {
                sum = sum.add(position.getTotalAmount());
                removeAt(list, i);
            } else {
                i++;
            }
        }
        if (sum.signum() == 0) {
            throw new LedgerException(ErrorType.NOTHING_TO_CLAIM);
        }
        return sum;
    }

    /**
     * 领取单个仓位，用于全量领取失败后的逐个恢复
     */
    public BigInteger claimAt(Address user, int index, long now) {
        List<Position> list = requirePositions(user);
        if (index < 0 || index >= list.size()) {
            throw new LedgerException(ErrorType.WRONG_STAKE_INDEX, "index=" + index + ", count=" + list.size());
        }
        Position position = list.get(index);
        if (!position.isMatured(now)) {
            throw new LedgerException(ErrorType.NOTHING_TO_CLAIM, "unlockTime=" + position.getUnlockTime());
        }
        removeAt(list, index);
        return position.getTotalAmount();
    }

    public List<Position> positionsOf(Address user) {
        List<Position> list = positions.get(user);
        return list == null ? Collections.emptyList() : new ArrayList<>(list);
    }

    public int count(Address user) {
        List<Position> list = positions.get(user);
        return list == null ? 0 : list.size();
    }

    public BigInteger total(Address user) {
        BigInteger sum = BigInteger.ZERO;
        for (Position position : positionsOf(user)) {
            sum = sum.add(position.getTotalAmount());
        }
        return sum;
    }

    public BigInteger matured(Address user, long now) {
        BigInteger sum = BigInteger.ZERO;
        for (Position position : positionsOf(user)) {
            if (position.isMatured(now)) {
                sum = sum.add(position.getTotalAmount());
            }
        }
        return sum;
    }

    // Position 不可变，浅拷贝即可
    public List<Position> snapshot(Address user) {
        return positionsOf(user);
    }

    public void restore(Address user, List<Position> snapshot) {
        positions.put(user, new ArrayList<>(snapshot));
    }

    private List<Position> requirePositions(Address user) {
        List<Position> list = positions.get(user);
        if (list == null || list.isEmpty()) {
            throw new LedgerException(ErrorType.NO_STAKES_FOR_CALLER);
        }
        return list;
    }

    private static void removeAt(List<Position> list, int index) {
        int last = list.size() - 1;
        list.set(index, list.get(last));
        list.remove(last);
    }
}
