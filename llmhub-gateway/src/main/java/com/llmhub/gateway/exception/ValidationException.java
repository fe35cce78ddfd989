package com.llmhub.gateway.exception;

import org.springframework.http.HttpStatus;

public class ValidationException extends GatewayException {

    public ValidationException(String message) {
        super(HttpStatus.BAD_REQUEST, "invalid_request_error", message);
    }
}
