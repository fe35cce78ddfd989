package com.llmhub.gateway.core.adapter;

import com.llmhub.gateway.core.model.ChatCompletionResult;
import com.llmhub.gateway.core.model.ChatRequest;
import com.llmhub.gateway.core.model.ProviderType;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * 归一化聊天接口与某个上游协议之间的翻译层，每个 provider 一个实现
 */
public interface ProviderAdapter {

    ProviderType provider();

    /**
     * 单次往返，上游完整响应到达后才发出结果。
     * 失败：{@code UpstreamException} / {@code AuthException} / {@code ValidationException}
     */
    Mono<ChatCompletionResult> chat(ChatRequest request);

    /**
     * 按到达顺序发出增量内容。不可重放；取消订阅会关闭上游连接；
     * 上游中途失败以 onError 结束，不会把错误混进内容里
     */
    Flux<String> streamChat(ChatRequest request);

    /**
     * 上游可用模型列表。没有列表能力的上游返回空列表而不是失败
     */
    Mono<List<String>> listModels();

    /**
     * 构造时调用，配置不合法抛出 {@code ConfigException}
     */
    void validateConfiguration();

    double estimateCost(String model, int promptTokens, int completionTokens);
}
