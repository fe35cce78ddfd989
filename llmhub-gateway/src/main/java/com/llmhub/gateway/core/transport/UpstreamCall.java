package com.llmhub.gateway.core.transport;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import org.springframework.http.HttpMethod;

import java.util.Map;

/**
 * 一次上游 HTTP 调用的描述，由适配器构造，交给 {@link UpstreamTransport} 执行
 */
@Value
@Builder
public class UpstreamCall {
    @Builder.Default
    HttpMethod method = HttpMethod.POST;
    String url;
    @Singular
    Map<String, String> headers;
    JsonNode body;
}
