package com.llmhub.gateway.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * 上游调用失败（HTTP 错误、网络异常、流中途中断）
 */
@Getter
public class UpstreamException extends GatewayException {

    /** 上游返回的状态码，网络层失败时为 0 */
    private final int upstreamStatus;
    private final String providerMessage;

    public UpstreamException(int upstreamStatus, String providerMessage) {
        this(upstreamStatus, providerMessage, null);
    }

    public UpstreamException(int upstreamStatus, String providerMessage, Throwable cause) {
        super(HttpStatus.BAD_GATEWAY, "upstream_error",
                upstreamStatus > 0
                        ? "Upstream returned " + upstreamStatus + ": " + providerMessage
                        : "Upstream unavailable: " + providerMessage,
                cause);
        this.upstreamStatus = upstreamStatus;
        this.providerMessage = providerMessage;
    }
}
