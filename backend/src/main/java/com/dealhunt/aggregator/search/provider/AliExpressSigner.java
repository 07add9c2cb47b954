package com.dealhunt.aggregator.search.provider;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Request signing for the AliExpress affiliate API: parameters sorted by name, concatenated as
 * {@code secret + k1 + v1 + k2 + v2 ... + secret}, then MD5 (or HMAC-MD5) as upper-case hex.
 */
public final class AliExpressSigner {
    private static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter
        .ofPattern("yyyy-MM-dd HH:mm:ss")
        .withZone(ZoneId.of("Asia/Shanghai"));

    private AliExpressSigner() {}

    public static String sign(Map<String, String> params, String secret, String signMethod) {
        StringBuilder plain = new StringBuilder(secret);
        for (Map.Entry<String, String> entry : new TreeMap<>(params).entrySet()) {
            if (entry.getValue() != null) {
                plain.append(entry.getKey()).append(entry.getValue());
            }
        }
        plain.append(secret);
        byte[] payload = plain.toString().getBytes(StandardCharsets.UTF_8);
        try {
            byte[] digest;
            if ("hmac".equalsIgnoreCase(signMethod)) {
                Mac mac = Mac.getInstance("HmacMD5");
                mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), "HmacMD5"));
                digest = mac.doFinal(payload);
            } else {
                digest = MessageDigest.getInstance("MD5").digest(payload);
            }
            return toHex(digest).toUpperCase(Locale.ROOT);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Unable to sign AliExpress request", e);
        }
    }

    public static String timestamp(Instant instant) {
        return TIMESTAMP_FORMAT.format(instant);
    }

    private static String toHex(byte[] bytes) {
        StringBuilder out = new StringBuilder();
        for (byte b : bytes) {
            out.append(String.format("%02x", b));
        }
        return out.toString();
    }
}
