package com.flagship.chain_webhooks.webhook;

import org.springframework.stereotype.Component;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.HexFormat;

/**
 * Verifies the HMAC-SHA256 signature of a webhook body.
 *
 * The MAC is computed over the exact bytes received and compared with the
 * hex-encoded signature in constant time. Any problem (missing signature,
 * non-hex signature, crypto failure) yields an invalid result; this class
 * never throws and has no side effects.
 */
@Component
public class SignatureVerifier {

    static final String ALGORITHM = "HmacSHA256";
    private static final int SIGNATURE_HEX_LENGTH = 64;

    public VerificationResult verify(byte[] rawBody, String suppliedSignature, String secret) {
        if (suppliedSignature == null || suppliedSignature.isBlank()) {
            return VerificationResult.invalid("Missing signature");
        }
        if (secret == null || secret.isEmpty()) {
            return VerificationResult.invalid("No signing secret configured");
        }
        String signature = suppliedSignature.trim();
        if (signature.length() != SIGNATURE_HEX_LENGTH) {
            return VerificationResult.invalid("Signature has wrong length");
        }

        try {
            byte[] supplied = HexFormat.of().parseHex(signature);
            byte[] expected = hmacSha256(rawBody == null ? new byte[0] : rawBody, secret);
            return MessageDigest.isEqual(expected, supplied)
                ? VerificationResult.valid()
                : VerificationResult.invalid("Signature mismatch");
        } catch (IllegalArgumentException e) {
            return VerificationResult.invalid("Signature is not hex encoded");
        } catch (Exception e) {
            return VerificationResult.invalid("Signature verification error: " + e.getClass().getSimpleName());
        }
    }

    /**
     * Hex HMAC-SHA256 of a body, as the provider computes it.
     */
    public static String sign(byte[] body, String secret) {
        try {
            return HexFormat.of().formatHex(hmacSha256(body, secret));
        } catch (Exception e) {
            throw new IllegalStateException("HMAC-SHA256 unavailable", e);
        }
    }

    private static byte[] hmacSha256(byte[] data, String secret) throws Exception {
        Mac mac = Mac.getInstance(ALGORITHM);
        mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), ALGORITHM));
        return mac.doFinal(data);
    }
}
