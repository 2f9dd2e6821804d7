package com.flagship.chain_webhooks.exception;

public class UnsupportedNetworkException extends RuntimeException {

    public UnsupportedNetworkException(String network) {
        super("Unsupported network: " + network);
    }
}
