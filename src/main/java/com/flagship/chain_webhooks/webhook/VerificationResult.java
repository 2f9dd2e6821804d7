package com.flagship.chain_webhooks.webhook;

import lombok.Value;

/**
 * Result of a signature check. The message explains a rejection and never
 * contains the secret or the supplied signature.
 */
@Value
public class VerificationResult {
    boolean valid;
    String message;

    public static VerificationResult valid() {
        return new VerificationResult(true, "Signature valid");
    }

    public static VerificationResult invalid(String message) {
        return new VerificationResult(false, message);
    }
}
