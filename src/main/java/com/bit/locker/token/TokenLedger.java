package com.bit.locker.token;

import com.bit.locker.common.Address;

import java.math.BigInteger;

/**
 * 同质化代币账本（外部协作方）
 * 调用方身份显式传入；转账类方法返回 false 表示拒绝，且不产生任何余额变化
 */
public interface TokenLedger {

    // 代币合约自身地址
    Address address();

    String name();

    String symbol();

    int decimals();

    BigInteger totalSupply();

    BigInteger balanceOf(Address owner);

    BigInteger allowance(Address owner, Address spender);

    // caller 将自身余额转给 to
    boolean transfer(Address caller, Address to, BigInteger amount);

    // caller 作为被授权方，从 from 转给 to
    boolean transferFrom(Address caller, Address from, Address to, BigInteger amount);

    boolean approve(Address caller, Address spender, BigInteger amount);
}
