package com.mmoss.ecommerce.domain.user;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * PasswordHasher - 비밀번호 SHA-256 해시
 *
 * 저장 형식은 소문자 16진수 64자.
 */
public class PasswordHasher {

    public String hash(String rawPassword) {
        if (rawPassword == null) {
            throw new IllegalArgumentException("Password is required");
        }
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            byte[] digest = md.digest(rawPassword.getBytes(StandardCharsets.UTF_8));
            StringBuilder sb = new StringBuilder(digest.length * 2);
            for (byte b : digest) {
                sb.append(String.format("%02x", b));
            }
            return sb.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is not available", e);
        }
    }

    public boolean matches(String rawPassword, String storedHash) {
        return rawPassword != null && storedHash != null
                && MessageDigest.isEqual(
                        hash(rawPassword).getBytes(StandardCharsets.UTF_8),
                        storedHash.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * 비밀번호 강도 검증: 최소 길이, 대문자 1개 이상, 숫자 1개 이상
     */
    public boolean isStrong(String rawPassword) {
        if (rawPassword == null || rawPassword.length() < UserConstants.MIN_PASSWORD_LENGTH) {
            return false;
        }
        boolean hasUpper = rawPassword.chars().anyMatch(Character::isUpperCase);
        boolean hasDigit = rawPassword.chars().anyMatch(Character::isDigit);
        return hasUpper && hasDigit;
    }
}
