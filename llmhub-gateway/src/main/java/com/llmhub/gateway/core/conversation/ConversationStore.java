package com.llmhub.gateway.core.conversation;

import com.llmhub.gateway.core.model.Conversation;
import com.llmhub.gateway.core.model.MessageRecord;
import reactor.core.publisher.Mono;

import java.util.List;

public interface ConversationStore {

    /**
     * 不存在或不属于 ownerId 时以 ResourceNotFoundException 结束
     */
    Mono<Conversation> getConversation(Long conversationId, Long ownerId);

    /**
     * 追加一条消息并分配会话内序号 seq
     */
    Mono<MessageRecord> appendMessage(MessageRecord message);

    /**
     * 按 seq 升序返回会话历史
     */
    Mono<List<MessageRecord>> getConversationHistory(Long conversationId);
}
