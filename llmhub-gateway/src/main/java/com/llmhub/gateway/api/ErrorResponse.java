package com.llmhub.gateway.api;

import com.llmhub.gateway.exception.GatewayException;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.http.HttpStatus;

/**
 * OpenAI 风格的错误体: {"error": {"message", "type", "code"}}
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ErrorResponse {

    private ErrorBody error;

    public static ErrorResponse of(HttpStatus status, String code, String message) {
        return new ErrorResponse(new ErrorBody(message, typeOf(status), code));
    }

    public static ErrorResponse from(Throwable e) {
        if (e instanceof GatewayException) {
            GatewayException ge = (GatewayException) e;
            return of(ge.getStatus(), ge.getCode(), ge.getMessage());
        }
        return of(HttpStatus.INTERNAL_SERVER_ERROR, "internal_error", "Internal server error");
    }

    private static String typeOf(HttpStatus status) {
        if (status == HttpStatus.UNAUTHORIZED || status == HttpStatus.FORBIDDEN) {
            return "authentication_error";
        }
        if (status == HttpStatus.TOO_MANY_REQUESTS) {
            return "rate_limit_error";
        }
        if (status == HttpStatus.NOT_FOUND) {
            return "not_found_error";
        }
        return status.is4xxClientError() ? "invalid_request_error" : "api_error";
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ErrorBody {
        private String message;
        private String type;
        private String code;
    }
}
