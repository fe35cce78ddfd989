package com.llmhub.gateway.core.conversation;

import com.llmhub.gateway.core.dao.ConversationMapper;
import com.llmhub.gateway.core.dao.MessageMapper;
import com.llmhub.gateway.core.model.Conversation;
import com.llmhub.gateway.core.model.MessageRecord;
import com.llmhub.gateway.exception.ResourceNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class MybatisConversationStore implements ConversationStore {

    private final ConversationMapper conversationMapper;
    private final MessageMapper messageMapper;
    private final TransactionTemplate transactionTemplate;

    @Override
    public Mono<Conversation> getConversation(Long conversationId, Long ownerId) {
        return Mono.fromCallable(() -> {
                    Conversation conversation = conversationMapper.findById(conversationId);
                    if (conversation == null || !conversation.getOwnerId().equals(ownerId)) {
                        throw new ResourceNotFoundException("Conversation " + conversationId + " not found");
                    }
                    return conversation;
                })
                .subscribeOn(Schedulers.boundedElastic());
    }

    @Override
    public Mono<MessageRecord> appendMessage(MessageRecord message) {
        return Mono.fromCallable(() -> transactionTemplate.execute(status -> insertWithSeq(message)))
                .subscribeOn(Schedulers.boundedElastic());
    }

    // 序号在插入的同一个短事务里分配，会话行锁不会跨越任何网络调用
    private MessageRecord insertWithSeq(MessageRecord message) {
        if (conversationMapper.incrementSeq(message.getConversationId()) == 0) {
            throw new ResourceNotFoundException("Conversation " + message.getConversationId() + " not found");
        }
        message.setSeq(conversationMapper.selectSeq(message.getConversationId()));
        if (message.getCreatedAt() == null) {
            message.setCreatedAt(LocalDateTime.now());
        }
        if (message.getMetadata() == null) {
            message.setMetadata(new LinkedHashMap<>());
        }
        messageMapper.insert(message);
        log.debug("Appended {} message #{} to conversation {}", message.getRole(), message.getSeq(),
                message.getConversationId());
        return message;
    }

    @Override
    public Mono<List<MessageRecord>> getConversationHistory(Long conversationId) {
        return Mono.fromCallable(() -> messageMapper.findByConversation(conversationId))
                .subscribeOn(Schedulers.boundedElastic());
    }
}
