package com.meridian.backend.service.signal;

import com.meridian.backend.model.SignalType;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Duration;
import java.time.Instant;
import java.util.HexFormat;

public final class SignalFingerprint {

    private static final int LENGTH = 16;

    private SignalFingerprint() {
    }

    /**
     * First 16 hex chars of SHA-256 over symbol, type, strategy and the start of the
     * time bucket containing {@code at}.
     */
    public static String of(String symbol, SignalType type, String strategyId, Instant at, Duration bucket) {
        long bucketStart = bucketStart(at, bucket).getEpochSecond();
        String material = symbol + "|" + type.name() + "|" + strategyId + "|" + bucketStart;
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(material.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash).substring(0, LENGTH);
        } catch (NoSuchAlgorithmException ex) {
            throw new IllegalStateException("SHA-256 not available", ex);
        }
    }

    public static Instant bucketStart(Instant at, Duration bucket) {
        long size = bucket.getSeconds();
        long epoch = at.getEpochSecond();
        return Instant.ofEpochSecond(Math.floorDiv(epoch, size) * size);
    }
}
