package com.llmhub.gateway.core.conversation;

import com.llmhub.gateway.core.adapter.AdapterFactory;
import com.llmhub.gateway.core.adapter.ProviderAdapter;
import com.llmhub.gateway.core.credential.CredentialStore;
import com.llmhub.gateway.core.model.ChatCompletionResult;
import com.llmhub.gateway.core.model.ChatMessage;
import com.llmhub.gateway.core.model.ChatRequest;
import com.llmhub.gateway.core.model.Conversation;
import com.llmhub.gateway.core.model.Credential;
import com.llmhub.gateway.core.model.MessageRecord;
import com.llmhub.gateway.core.model.Role;
import com.llmhub.gateway.core.router.CredentialRateLimiter;
import com.llmhub.gateway.core.usage.UsageContext;
import com.llmhub.gateway.core.usage.UsageRecorder;
import com.llmhub.gateway.exception.NoCapacityException;
import com.llmhub.gateway.exception.ValidationException;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;

/**
 * 会话内聊天：使用会话绑定的凭证和模型，带上历史消息，结果落库
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ConversationChatService {

    private final ConversationStore conversationStore;
    private final CredentialStore credentialStore;
    private final AdapterFactory adapterFactory;
    private final CredentialRateLimiter rateLimiter;
    private final UsageRecorder usageRecorder;

    /**
     * 已就绪的一次会话调用：用户消息已落库，适配器已构建
     */
    @Value
    public static class PreparedChat {
        Conversation conversation;
        Credential credential;
        ChatRequest request;
        ProviderAdapter adapter;

        UsageContext usageContext() {
            return UsageContext.builder()
                    .credentialId(credential.getId())
                    .provider(credential.getProvider())
                    .model(request.getModel())
                    .conversationId(conversation.getId())
                    .build();
        }
    }

    public Mono<ChatCompletionResult> chat(Long conversationId, Long ownerId, String content,
                                           Double temperature, Integer maxTokens) {
        return prepare(conversationId, ownerId, content, temperature, maxTokens)
                .flatMap(prepared -> prepared.getAdapter().chat(prepared.getRequest())
                        .flatMap(result -> usageRecorder.recordCompletion(prepared.usageContext(), result)));
    }

    public Flux<String> streamChat(PreparedChat prepared) {
        return usageRecorder.recordStream(prepared.usageContext(), prepared.getAdapter().streamChat(prepared.getRequest()));
    }

    public Mono<PreparedChat> prepare(Long conversationId, Long ownerId, String content,
                                      Double temperature, Integer maxTokens) {
        if (content == null || content.isBlank()) {
            return Mono.error(new ValidationException("content must not be empty"));
        }
        return conversationStore.getConversation(conversationId, ownerId)
                .flatMap(conversation -> loadCredential(conversation, ownerId)
                        .flatMap(credential -> conversationStore.getConversationHistory(conversationId)
                                .map(history -> ChatRequest.builder()
                                        .model(conversation.getModel())
                                        .messages(buildMessages(conversation, history, content))
                                        .temperature(temperature)
                                        .maxTokens(maxTokens)
                                        .build())
                                .flatMap(request -> {
                                    ProviderAdapter adapter = adapterFactory.createAdapterFromCredential(credential);
                                    if (!rateLimiter.tryAcquire(credential)) {
                                        return Mono.error(NoCapacityException.rateLimited(credential.getProvider()));
                                    }
                                    return conversationStore.appendMessage(userMessage(conversationId, content))
                                            .thenReturn(new PreparedChat(conversation, credential, request, adapter));
                                })));
    }

    private Mono<Credential> loadCredential(Conversation conversation, Long ownerId) {
        if (conversation.getCredentialId() == null) {
            return Mono.error(new ValidationException("Conversation " + conversation.getId() + " has no credential"));
        }
        return credentialStore.getCredential(conversation.getCredentialId(), ownerId)
                .flatMap(credential -> credential.isUsable()
                        ? Mono.just(credential)
                        : Mono.error(new ValidationException("Credential " + credential.getId() + " is inactive")));
    }

    private static List<ChatMessage> buildMessages(Conversation conversation, List<MessageRecord> history, String content) {
        List<ChatMessage> messages = new ArrayList<>();
        if (conversation.getSystemPrompt() != null && !conversation.getSystemPrompt().isBlank()) {
            messages.add(ChatMessage.system(conversation.getSystemPrompt()));
        }
        for (MessageRecord record : history) {
            messages.add(ChatMessage.of(Role.fromValue(record.getRole()), record.getContent()));
        }
        messages.add(ChatMessage.user(content));
        return messages;
    }

    private static MessageRecord userMessage(Long conversationId, String content) {
        return MessageRecord.builder()
                .conversationId(conversationId)
                .role(Role.USER.value())
                .content(content)
                .build();
    }
}
