package com.sandkev.cryptex.shared.http;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.util.HexFormat;

/** Sign = hex( HMAC-SHA512( secret, urlencoded POST body ) ) */
public final class HmacSigner {

    private static final String ALGORITHM = "HmacSHA512";

    private HmacSigner() {}

    public static String sign(String secret, String payload) {
        try {
            Mac mac = Mac.getInstance(ALGORITHM);
            mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), ALGORITHM));
            return HexFormat.of().formatHex(mac.doFinal(payload.getBytes(StandardCharsets.UTF_8)));
        } catch (Exception e) {
            throw new IllegalStateException("Sign computation failed", e);
        }
    }
}
