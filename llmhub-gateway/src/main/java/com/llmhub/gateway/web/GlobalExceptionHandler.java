package com.llmhub.gateway.web;

import com.llmhub.gateway.api.ErrorResponse;
import com.llmhub.gateway.exception.GatewayException;
import com.llmhub.gateway.exception.UpstreamException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ResponseStatusException;

import java.util.stream.Collectors;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(GatewayException.class)
    public ResponseEntity<ErrorResponse> handleGateway(GatewayException e) {
        if (e instanceof UpstreamException) {
            UpstreamException ue = (UpstreamException) e;
            log.warn("Upstream failure (status {}): {}", ue.getUpstreamStatus(), ue.getProviderMessage());
        } else {
            log.info("Request rejected with {}: {}", e.getCode(), e.getMessage());
        }
        return ResponseEntity.status(e.getStatus()).body(ErrorResponse.from(e));
    }

    @ExceptionHandler(WebExchangeBindException.class)
    public ResponseEntity<ErrorResponse> handleBind(WebExchangeBindException e) {
        String message = e.getFieldErrors().stream()
                .map(GlobalExceptionHandler::describe)
                .collect(Collectors.joining("; "));
        return ResponseEntity.badRequest()
                .body(ErrorResponse.of(HttpStatus.BAD_REQUEST, "invalid_request_error",
                        message.isEmpty() ? "Invalid request" : message));
    }

    // 缺少请求头、JSON 无法解析、不支持的 Content-Type 等框架层错误
    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<ErrorResponse> handleStatus(ResponseStatusException e) {
        HttpStatus status = HttpStatus.resolve(e.getStatusCode().value());
        if (status == null) {
            status = HttpStatus.BAD_REQUEST;
        }
        String message = e.getReason() != null ? e.getReason() : status.getReasonPhrase();
        return ResponseEntity.status(status)
                .body(ErrorResponse.of(status, status.is4xxClientError() ? "invalid_request_error" : "api_error", message));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnexpected(Exception e) {
        log.error("Unexpected error", e);
        return ResponseEntity.internalServerError().body(ErrorResponse.from(e));
    }

    private static String describe(FieldError error) {
        return error.getField() + ": " + error.getDefaultMessage();
    }
}
