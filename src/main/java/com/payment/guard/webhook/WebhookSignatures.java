package com.payment.guard.webhook;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.InvalidKeyException;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * HMAC-SHA256 over {@code timestamp + "." + body}, hex encoded. The scheme every supported
 * provider signs deliveries with.
 */
public final class WebhookSignatures {

    static final String HMAC_ALGORITHM = "HmacSHA256";
    public static final String PREFIX = "sha256=";

    private WebhookSignatures() {
    }

    public static byte[] hmac(String secret, String timestamp, String body) {
        try {
            Mac mac = Mac.getInstance(HMAC_ALGORITHM);
            mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), HMAC_ALGORITHM));
            return mac.doFinal((timestamp + "." + body).getBytes(StandardCharsets.UTF_8));
        } catch (NoSuchAlgorithmException | InvalidKeyException e) {
            throw new IllegalStateException("Failed to compute webhook HMAC", e);
        }
    }

    /** Lower-case hex signature, without prefix. */
    public static String sign(String secret, String timestamp, String body) {
        return HexFormat.of().formatHex(hmac(secret, timestamp, body));
    }

    /**
     * Decodes a signature header into raw bytes after removing an optional {@code sha256=} prefix.
     *
     * @return null when the header is not valid hex
     */
    static byte[] decodeHeader(String header) {
        String hex = header.trim();
        if (hex.regionMatches(true, 0, PREFIX, 0, PREFIX.length())) {
            hex = hex.substring(PREFIX.length());
        }
        if (hex.isEmpty() || hex.length() % 2 != 0) {
            return null;
        }
        try {
            return HexFormat.of().parseHex(hex);
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
