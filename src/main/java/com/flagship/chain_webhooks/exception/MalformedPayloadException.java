package com.flagship.chain_webhooks.exception;

/**
 * Authenticated webhook body that is not valid JSON or lacks a required
 * field. Maps to 400.
 */
public class MalformedPayloadException extends RuntimeException {

    public MalformedPayloadException(String message) {
        super(message);
    }

    public MalformedPayloadException(String message, Throwable cause) {
        super(message, cause);
    }
}
