package com.llmhub.gateway.exception;

import org.springframework.http.HttpStatus;

/**
 * 适配器配置缺失或非法（缺少密钥、base_url 格式错误等）
 */
public class ConfigException extends GatewayException {

    public ConfigException(String message) {
        super(HttpStatus.BAD_REQUEST, "invalid_configuration", message);
    }
}
