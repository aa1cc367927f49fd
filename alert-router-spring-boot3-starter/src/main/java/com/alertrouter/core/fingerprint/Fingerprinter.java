package com.alertrouter.core.fingerprint;

import com.alertrouter.model.Alert;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Map;
import java.util.StringJoiner;
import java.util.TreeMap;

/**
 * 告警指纹: 标签按 key 排序后拼接 key=value, 取 SHA-1 十六进制
 * 与标签插入顺序无关
 */
public final class Fingerprinter {

    private static final char[] HEX = "0123456789abcdef".toCharArray();

    private Fingerprinter() {}

    public static String fingerprint(Map<String, String> labels) {
        StringJoiner canonical = new StringJoiner(",");
        if (labels != null) {
            new TreeMap<>(labels).forEach((k, v) -> canonical.add(k + "=" + v));
        }
        return sha1Hex(canonical.toString().getBytes(StandardCharsets.UTF_8));
    }

    /**
     * 已有指纹则不重新计算
     */
    public static Alert ensure(Alert alert) {
        if (alert.getFingerprint() == null || alert.getFingerprint().isEmpty()) {
            alert.setFingerprint(fingerprint(alert.getLabels()));
        }
        return alert;
    }

    private static String sha1Hex(byte[] data) {
        try {
            byte[] digest = MessageDigest.getInstance("SHA-1").digest(data);
            char[] out = new char[digest.length * 2];
            for (int i = 0; i < digest.length; i++) {
                out[i * 2] = HEX[(digest[i] >> 4) & 0xf];
                out[i * 2 + 1] = HEX[digest[i] & 0xf];
            }
            return new String(out);
        } catch (NoSuchAlgorithmException e) {
            // 每个 JRE 都必须提供 SHA-1
            throw new IllegalStateException(e);
        }
    }
}
