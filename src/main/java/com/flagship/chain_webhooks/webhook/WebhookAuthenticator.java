package com.flagship.chain_webhooks.webhook;

import com.flagship.chain_webhooks.exception.InvalidSignatureException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Holds the shared webhook secret and rejects unsigned or badly signed
 * bodies. A blank secret is a configuration error and fails startup.
 */
@Component
@Slf4j
public class WebhookAuthenticator {

    private final SignatureVerifier signatureVerifier;
    private final String secret;

    public WebhookAuthenticator(SignatureVerifier signatureVerifier,
                                @Value("${webhook.secret:}") String secret) {
        if (secret == null || secret.isBlank()) {
            throw new IllegalStateException("webhook.secret is not configured; refusing to accept unsigned webhooks");
        }
        this.signatureVerifier = signatureVerifier;
        this.secret = secret;
    }

    /**
     * @throws InvalidSignatureException if the signature does not match the body
     */
    public void authenticate(byte[] rawBody, String signature) {
        VerificationResult result = signatureVerifier.verify(rawBody, signature, secret);
        if (!result.isValid()) {
            throw new InvalidSignatureException(result.getMessage());
        }
    }
}
