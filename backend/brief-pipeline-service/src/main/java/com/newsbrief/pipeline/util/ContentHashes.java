package com.newsbrief.pipeline.util;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Locale;

public final class ContentHashes {

    private ContentHashes() {
    }

    /**
     * 뉴스 지문: 소문자 제목 + 정규 URL(쿼리 제외)의 SHA-256
     */
    public static String fingerprint(String title, String url) {
        String normalizedTitle = TextNormalizer.normalize(title).toLowerCase(Locale.ROOT);
        String canonicalUrl = UrlNormalizer.canonicalize(url);
        return sha256(normalizedTitle + "\n" + canonicalUrl);
    }

    public static String sha256(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest((value != null ? value : "").getBytes(StandardCharsets.UTF_8));
            StringBuilder hexString = new StringBuilder();
            for (byte b : hash) {
                String hex = Integer.toHexString(0xff & b);
                if (hex.length() == 1) hexString.append('0');
                hexString.append(hex);
            }
            return hexString.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 algorithm not available", e);
        }
    }
}
