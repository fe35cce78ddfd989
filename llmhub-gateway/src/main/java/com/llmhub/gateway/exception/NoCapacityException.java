package com.llmhub.gateway.exception;

import org.springframework.http.HttpStatus;

/**
 * 没有可用的上游凭证。对外统一 429，错误码区分“未配置”与“被限流”
 */
public class NoCapacityException extends GatewayException {

    public static final String NO_CREDENTIAL = "no_upstream_credential";
    public static final String RATE_LIMITED = "rate_limited";

    private NoCapacityException(String code, String message) {
        super(HttpStatus.TOO_MANY_REQUESTS, code, message);
    }

    public static NoCapacityException noCredential(String provider) {
        return new NoCapacityException(NO_CREDENTIAL,
                "No available upstream capacity for provider '" + provider + "'");
    }

    public static NoCapacityException rateLimited(String provider) {
        return new NoCapacityException(RATE_LIMITED,
                "All credentials for provider '" + provider + "' reached their rate limit");
    }
}
