package com.bit.locker.token.impl;

import com.bit.locker.common.Address;
import com.bit.locker.token.TokenLedger;
import lombok.extern.slf4j.Slf4j;

import java.math.BigInteger;
import java.util.HashMap;
import java.util.Map;

/**
 * 内存代币账本：固定总量，启动时全部铸造给持有人
 * 授权额度为 MAX_UINT256 时视为无限授权，不做扣减
 */
@Slf4j
public class MemoryTokenLedger implements TokenLedger {

    public static final BigInteger MAX_UINT256 = BigInteger.ONE.shiftLeft(256).subtract(BigInteger.ONE);

    private final Address address;
    private final String name;
    private final String symbol;
    private final int decimals;
    private final BigInteger totalSupply;

    private final Map<Address, BigInteger> balances = new HashMap<>();
    private final Map<Address, Map<Address, BigInteger>> allowances = new HashMap<>();

    public MemoryTokenLedger(Address address, String name, String symbol, int decimals, Address holder, BigInteger initialSupply) {
        if (initialSupply.signum() < 0) {
            throw new IllegalArgumentException("初始发行量不能为负: " + initialSupply);
        }
        this.address = address;
        this.name = name;
        this.symbol = symbol;
        this.decimals = decimals;
        this.totalSupply = initialSupply;
        balances.put(holder, initialSupply);
        log.info("代币账本初始化完成 {}({}), 发行量 {} 归属 {}", name, symbol, initialSupply, holder);
    }

    @Override
    public Address address() {
        return address;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public String symbol() {
        return symbol;
    }

    @Override
    public int decimals() {
        return decimals;
    }

    @Override
    public BigInteger totalSupply() {
        return totalSupply;
    }

    @Override
    public synchronized BigInteger balanceOf(Address owner) {
        return balances.getOrDefault(owner, BigInteger.ZERO);
    }

    @Override
    public synchronized BigInteger allowance(Address owner, Address spender) {
        Map<Address, BigInteger> granted = allowances.get(owner);
        return granted == null ? BigInteger.ZERO : granted.getOrDefault(spender, BigInteger.ZERO);
    }

    @Override
    public synchronized boolean transfer(Address caller, Address to, BigInteger amount) {
        return move(caller, to, amount);
    }

    @Override
    public synchronized boolean transferFrom(Address caller, Address from, Address to, BigInteger amount) {
        if (amount.signum() < 0) {
            log.debug("转账拒绝：金额为负 {}", amount);
            return false;
        }
        BigInteger granted = allowance(from, caller);
        if (granted.compareTo(amount) < 0) {
            log.debug("转账拒绝：ERC20: allowance to low, owner={}, spender={}, 额度={}, 需要={}", from, caller, granted, amount);
            return false;
        }
        if (!move(from, to, amount)) {
            return false;
        }
        if (!granted.equals(MAX_UINT256)) {
            allowances.computeIfAbsent(from, k -> new HashMap<>()).put(caller, granted.subtract(amount));
        }
        return true;
    }

    @Override
    public synchronized boolean approve(Address caller, Address spender, BigInteger amount) {
        if (spender == null || spender.isZero() || amount.signum() < 0) {
            log.debug("授权拒绝：spender={}, amount={}", spender, amount);
            return false;
        }
        allowances.computeIfAbsent(caller, k -> new HashMap<>()).put(spender, amount);
        return true;
    }

    private boolean move(Address from, Address to, BigInteger amount) {
        if (to == null || to.isZero() || amount.signum() < 0) {
            log.debug("转账拒绝：to={}, amount={}", to, amount);
            return false;
        }
        BigInteger fromBalance = balanceOf(from);
        if (fromBalance.compareTo(amount) < 0) {
            log.debug("转账拒绝：ERC20: balance to low, from={}, 余额={}, 需要={}", from, fromBalance, amount);
            return false;
        }
        balances.put(from, fromBalance.subtract(amount));
        balances.put(to, balanceOf(to).add(amount));
        return true;
    }
}
