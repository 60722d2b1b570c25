package com.bit.locker.common;

import com.bit.locker.util.ByteUtils;
import com.bit.locker.util.Sha;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.EqualsAndHashCode;

import java.util.Arrays;

/**
 * 账户/合约地址封装（20字节），文本形式为 0x 开头的小写十六进制
 */
@EqualsAndHashCode
public final class Address {
    public static final int LENGTH = 20;

    public static final Address ZERO = new Address(new byte[LENGTH]);

    private final byte[] value;

    private Address(byte[] value) {
        if (value.length != LENGTH) {
            throw new IllegalArgumentException("地址必须为20字节，实际: " + value.length);
        }
        this.value = value;
    }

    @JsonCreator
    public static Address fromHex(String hex) {
        if (hex == null) {
            throw new IllegalArgumentException("地址不能为空");
        }
        return new Address(ByteUtils.hexToBytes(hex.trim()));
    }

    /**
     * 由任意标识派生确定性地址：keccak256(seed) 的后20字节
     */
    public static Address derive(String seed) {
        byte[] hash = Sha.applyKeccak256(seed);
        return new Address(Arrays.copyOfRange(hash, hash.length - LENGTH, hash.length));
    }

    public boolean isZero() {
        for (byte b : value) {
            if (b != 0) {
                return false;
            }
        }
        return true;
    }

    @JsonValue
    @Override
    public String toString() {
        return "0x" + ByteUtils.bytesToHex(value);
    }
}
