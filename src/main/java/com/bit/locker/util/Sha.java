package com.bit.locker.util;

import org.bouncycastle.jcajce.provider.digest.Keccak;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

public class Sha {
    // Keccak-256（以太坊风格，非 SHA3-256 填充），每个线程独立实例
    private static final ThreadLocal<MessageDigest> KECCAK256_THREAD_LOCAL = ThreadLocal.withInitial(Keccak.Digest256::new);

    public static byte[] applyKeccak256(byte[] data) {
        MessageDigest digest = KECCAK256_THREAD_LOCAL.get();
        digest.reset();
        return digest.digest(data);
    }

    public static byte[] applyKeccak256(String text) {
        return applyKeccak256(text.getBytes(StandardCharsets.UTF_8));
    }
}
