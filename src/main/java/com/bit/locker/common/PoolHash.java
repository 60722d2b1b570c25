package com.bit.locker.common;

import com.bit.locker.util.ByteUtils;
import com.bit.locker.util.Sha;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.math.BigInteger;
import java.util.Arrays;

/**
 * 质押池身份哈希（32字节）
 * 池在数组中的下标会因回收而变化，只有哈希是稳定的外部引用
 */
public final class PoolHash {
    public static final int HASH_LENGTH = 32;

    private final byte[] value;

    private PoolHash(byte[] value) {
        if (value == null) {
            throw new NullPointerException("Hash value cannot be null");
        }
        if (value.length != HASH_LENGTH) {
            throw new IllegalArgumentException("Hash must be exactly " + HASH_LENGTH + " bytes long, but got " + value.length);
        }
        this.value = Arrays.copyOf(value, HASH_LENGTH);
    }

    @JsonCreator
    public static PoolHash fromHex(String hex) {
        return new PoolHash(ByteUtils.hexToBytes(hex));
    }

    /**
     * keccak256(abi.encode(minStake, maxStake, startTime, endTime, rewardPermill, lockPeriod, maxTotalStaked))
     */
    public static PoolHash of(BigInteger minStake, BigInteger maxStake, long startTime, long endTime,
                              long rewardPermill, long lockPeriod, BigInteger maxTotalStaked) {
        byte[] encoded = ByteUtils.concat(
                ByteUtils.toUint256(minStake),
                ByteUtils.toUint256(maxStake),
                ByteUtils.toUint256(startTime),
                ByteUtils.toUint256(endTime),
                ByteUtils.toUint256(rewardPermill),
                ByteUtils.toUint256(lockPeriod),
                ByteUtils.toUint256(maxTotalStaked));
        return new PoolHash(Sha.applyKeccak256(encoded));
    }

    @JsonValue
    public String toHex() {
        return "0x" + ByteUtils.bytesToHex(value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        PoolHash hash = (PoolHash) o;
        return Arrays.equals(value, hash.value);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(value);
    }

    @Override
    public String toString() {
        return toHex();
    }
}
