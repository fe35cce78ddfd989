package com.llmhub.gateway.exception;

import org.springframework.http.HttpStatus;

public class ResourceNotFoundException extends GatewayException {

    public ResourceNotFoundException(String message) {
        super(HttpStatus.NOT_FOUND, "not_found", message);
    }
}
