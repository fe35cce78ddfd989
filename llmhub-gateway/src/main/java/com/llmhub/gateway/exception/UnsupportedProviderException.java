package com.llmhub.gateway.exception;

import org.springframework.http.HttpStatus;

public class UnsupportedProviderException extends GatewayException {

    public UnsupportedProviderException(String provider) {
        super(HttpStatus.BAD_REQUEST, "unsupported_provider", "Unsupported provider: " + provider);
    }
}
