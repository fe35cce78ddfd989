package com.llmhub.gateway.exception;

import org.springframework.http.HttpStatus;

/**
 * 凭证被拒绝：网关客户端 token 无效，或上游拒绝了我们持有的 API Key
 */
public class AuthException extends GatewayException {

    public AuthException(String message) {
        super(HttpStatus.UNAUTHORIZED, "invalid_api_key", message);
    }

    public AuthException(HttpStatus status, String message, Throwable cause) {
        super(status, status == HttpStatus.FORBIDDEN ? "permission_denied" : "invalid_api_key", message, cause);
    }
}
