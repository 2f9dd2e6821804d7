package com.flagship.chain_webhooks.exception;

/**
 * Webhook body did not carry a valid HMAC signature. Maps to 401.
 */
public class InvalidSignatureException extends RuntimeException {

    public InvalidSignatureException(String message) {
        super(message);
    }
}
