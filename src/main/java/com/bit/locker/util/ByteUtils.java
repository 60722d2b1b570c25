package com.bit.locker.util;

import java.math.BigInteger;

public class ByteUtils {

    // uint256 固定32字节
    public static final int WORD_LENGTH = 32;

    /**
     * 字节数组转十六进制字符串（小写，无前缀）
     */
    public static String bytesToHex(byte[] bytes) {
        StringBuilder result = new StringBuilder(bytes.length * 2);
        for (byte b : bytes) {
            result.append(String.format("%02x", b));
        }
        return result.toString();
    }

    /**
     * 十六进制字符串转字节数组，允许 0x 前缀
     */
    public static byte[] hexToBytes(String hex) {
        String clean = hex.startsWith("0x") || hex.startsWith("0X") ? hex.substring(2) : hex;
        if (clean.length() % 2 != 0) {
            throw new IllegalArgumentException("十六进制长度必须为偶数: " + hex);
        }
        int len = clean.length();
        byte[] data = new byte[len / 2];
        for (int i = 0; i < len; i += 2) {
            int high = Character.digit(clean.charAt(i), 16);
            int low = Character.digit(clean.charAt(i + 1), 16);
            if (high < 0 || low < 0) {
                throw new IllegalArgumentException("非法十六进制字符: " + hex);
            }
            data[i / 2] = (byte) ((high << 4) + low);
        }
        return data;
    }

    /**
     * 非负整数编码为32字节大端（与 abi.encode(uint256) 一致）
     */
    public static byte[] toUint256(BigInteger value) {
        if (value.signum() < 0 || value.bitLength() > 256) {
            throw new IllegalArgumentException("超出 uint256 范围: " + value);
        }
        byte[] raw = value.toByteArray();
        byte[] word = new byte[WORD_LENGTH];
        int copy = Math.min(raw.length, WORD_LENGTH);
        System.arraycopy(raw, raw.length - copy, word, WORD_LENGTH - copy, copy);
        return word;
    }

    public static byte[] toUint256(long value) {
        return toUint256(BigInteger.valueOf(value));
    }

    /**
     * 按顺序拼接多个32字节字
     */
    public static byte[] concat(byte[]... words) {
        int total = 0;
        for (byte[] w : words) {
            total += w.length;
        }
        byte[] combined = new byte[total];
        int offset = 0;
        for (byte[] w : words) {
            System.arraycopy(w, 0, combined, offset, w.length);
            offset += w.length;
        }
        return combined;
    }
}
