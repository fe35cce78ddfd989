package com.llmhub.gateway.core.usage;

import com.llmhub.gateway.core.conversation.ConversationStore;
import com.llmhub.gateway.core.credential.CredentialStore;
import com.llmhub.gateway.core.model.ChatCompletionResult;
import com.llmhub.gateway.core.model.MessageRecord;
import com.llmhub.gateway.core.model.Role;
import com.llmhub.gateway.core.model.Usage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.SignalType;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 把一次完成的交换落成 assistant 消息，并刷新凭证的 last_used_at。
 * 每次交换最多记录一次；流式交换在任何分片到达前失败则不记录
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class UsageRecorder {

    private final CredentialStore credentialStore;
    private final ConversationStore conversationStore;

    /**
     * 非流式：记录完成后原样返回结果。记录失败只记日志，不影响已拿到的结果
     */
    public Mono<ChatCompletionResult> recordCompletion(UsageContext context, ChatCompletionResult result) {
        Usage usage = result.getUsage();
        log.info("Usage: credential={}, provider={}, model={}, tokens={}, cost={}",
                context.getCredentialId(), context.getProvider(), context.getModel(),
                usage != null ? usage.getTotalTokens() : "unknown", result.getCostUsd());

        Map<String, Object> metadata = new LinkedHashMap<>(result.getProviderMetadata());
        metadata.put("provider", context.getProvider());
        metadata.put("model", context.getModel());
        if (result.getFinishReason() != null) {
            metadata.put("finish_reason", result.getFinishReason());
        }
        MessageRecord.MessageRecordBuilder message = MessageRecord.builder()
                .conversationId(context.getConversationId())
                .role(Role.ASSISTANT.value())
                .content(result.getContent())
                .cost(result.getCostUsd())
                .metadata(metadata);
        if (usage != null) {
            message.promptTokens(usage.getPromptTokens())
                    .completionTokens(usage.getCompletionTokens())
                    .totalTokens(usage.getTotalTokens());
        }
        return persist(context, message.build())
                .onErrorResume(e -> {
                    log.error("Failed to record usage for credential {}: {}", context.getCredentialId(), e.getMessage(), e);
                    return Mono.empty();
                })
                .thenReturn(result);
    }

    /**
     * 流式：透传分片，在流结束（完成、出错或客户端断开）时记录拼接后的内容。
     * usage 和 cost 在流式下拿不到，记为空
     */
    public Flux<String> recordStream(UsageContext context, Flux<String> fragments) {
        return Flux.defer(() -> {
            // onNext 与 cancel 可能在不同线程，append 和快照都需要同步
            StringBuffer content = new StringBuffer();
            AtomicBoolean received = new AtomicBoolean();
            AtomicBoolean recorded = new AtomicBoolean();
            return fragments
                    .doOnNext(fragment -> {
                        received.set(true);
                        content.append(fragment);
                    })
                    .doFinally(signal -> {
                        boolean completed = signal == SignalType.ON_COMPLETE;
                        if (!completed && !received.get()) {
                            log.info("Stream for credential {} ended with {} before any content, nothing recorded",
                                    context.getCredentialId(), signal);
                            return;
                        }
                        if (!recorded.compareAndSet(false, true)) {
                            return;
                        }
                        String text = content.toString();
                        if (signal == SignalType.CANCEL) {
                            log.warn("Client disconnected, recording partial stream ({} chars)", text.length());
                        }
                        log.info("Usage: credential={}, provider={}, model={}, streamed {} chars",
                                context.getCredentialId(), context.getProvider(), context.getModel(), text.length());
                        Map<String, Object> metadata = new LinkedHashMap<>();
                        metadata.put("provider", context.getProvider());
                        metadata.put("model", context.getModel());
                        metadata.put("streamed", true);
                        metadata.put("completed", completed);
                        MessageRecord message = MessageRecord.builder()
                                .conversationId(context.getConversationId())
                                .role(Role.ASSISTANT.value())
                                .content(text)
                                .metadata(metadata)
                                .build();
                        persist(context, message).subscribe(null, e -> log.error(
                                "Failed to record stream usage for credential {}: {}",
                                context.getCredentialId(), e.getMessage(), e));
                    });
        });
    }

    private Mono<Void> persist(UsageContext context, MessageRecord message) {
        Mono<Void> touch = credentialStore.touch(context.getCredentialId());
        if (context.getConversationId() == null) {
            return touch;
        }
        return touch.then(conversationStore.appendMessage(message)).then();
    }
}
