package com.llmhub.gateway.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * 网关统一异常基类，携带对外的 HTTP 状态码和错误码
 */
@Getter
public abstract class GatewayException extends RuntimeException {

    private final HttpStatus status;
    private final String code;

    protected GatewayException(HttpStatus status, String code, String message) {
        super(message);
        this.status = status;
        this.code = code;
    }

    protected GatewayException(HttpStatus status, String code, String message, Throwable cause) {
        super(message, cause);
        this.status = status;
        this.code = code;
    }
}
