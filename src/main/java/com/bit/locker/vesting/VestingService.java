package com.bit.locker.vesting;

import com.bit.locker.common.Address;
import com.bit.locker.stake.StakeService;
import com.bit.locker.structure.vesting.Vest;

import java.math.BigInteger;
import java.util.List;

/**
 * 归属账本：托管管理员存入的授予，按时间线性释放；
 * 对外模仿 ERC20（name/symbol/decimals/balanceOf/transfer），钱包无需特殊处理即可显示余额
 */
public interface VestingService {

    Address address();

    Address tokenAddress();

    /**
     * 新增授予，从管理员拉取 totalAmount
     */
    Vest addLock(Address caller, Address beneficiary, BigInteger startAmount, BigInteger totalAmount,
                 long startDate, long endDate);

    BigInteger claimAll(Address caller);

    /**
     * 领取后直接存入质押账本的桥接池
     */
    BigInteger claim2stake(Address caller);

    /**
     * 一次性绑定质押账本，要求对方报告的归属地址就是本账本
     */
    void setStakeAddress(Address caller, StakeService stakeService);

    Address stakeAddress();

    BigInteger vested();

    int getVestingsCount(Address user);

    Vest getVesting(Address user, int index);

    List<Vest> getVestings(Address user);

    BigInteger claimable(Address user);

    String name();

    String symbol();

    int decimals();

    BigInteger totalSupply();

    BigInteger balanceOf(Address user);

    /**
     * 触发领取，忽略 to 与 amount
     */
    BigInteger transfer(Address caller, Address to, BigInteger amount);
}
