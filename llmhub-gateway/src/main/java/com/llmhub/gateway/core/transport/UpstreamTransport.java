package com.llmhub.gateway.core.transport;

import com.fasterxml.jackson.databind.JsonNode;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * 适配器与具体 HTTP 客户端之间的最小接口，测试中可替换为内存实现。
 * 失败统一以 {@link com.llmhub.gateway.exception.GatewayException} 子类发出
 */
public interface UpstreamTransport {

    /**
     * 发送请求并返回完整的 JSON 响应体
     */
    Mono<JsonNode> exchange(UpstreamCall call);

    /**
     * 发送流式请求，按到达顺序返回每个 SSE 事件的 data 字段。
     * 取消订阅即关闭上游连接
     */
    Flux<String> stream(UpstreamCall call);
}
