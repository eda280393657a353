package com.blogpulse.analytics.util;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * 匿名访客标识：对 {@code ip-userAgent} 做 SHA-256，输出小写十六进制。
 * 同一设备在 IP 不变时得到稳定标识，用于访客去重。
 */
public final class VisitorIds {

    private VisitorIds() {}

    public static String fromRequest(String ip, String userAgent) {
        String raw = (ip == null ? "" : ip) + "-" + (userAgent == null ? "" : userAgent);
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            byte[] digest = md.digest(raw.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(digest);
        } catch (NoSuchAlgorithmException e) {
            // JDK 必须提供 SHA-256
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
