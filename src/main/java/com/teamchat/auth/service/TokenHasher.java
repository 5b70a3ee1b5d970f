package com.teamchat.auth.service;

import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * raw token -> sha256 小写 hex。库里只存这个值。
 */
@Component
public class TokenHasher {

    private static final char[] HEX = "0123456789abcdef".toCharArray();

    public String sha256Hex(String rawToken) {
        if (rawToken == null) {
            throw new IllegalArgumentException("token is null");
        }
        MessageDigest digest;
        try {
            digest = MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("sha-256 unavailable", e);
        }
        byte[] bytes = digest.digest(rawToken.getBytes(StandardCharsets.UTF_8));
        char[] out = new char[bytes.length * 2];
        for (int i = 0; i < bytes.length; i++) {
            out[i * 2] = HEX[(bytes[i] >> 4) & 0xF];
            out[i * 2 + 1] = HEX[bytes[i] & 0xF];
        }
        return new String(out);
    }
}
