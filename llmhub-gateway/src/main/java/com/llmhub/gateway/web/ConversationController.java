package com.llmhub.gateway.web;

import com.llmhub.gateway.api.ChatCompletionResponse;
import com.llmhub.gateway.api.ConversationChatRequest;
import com.llmhub.gateway.core.conversation.ConversationChatService;
import com.llmhub.gateway.core.stream.StreamBridge;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api/conversations")
@RequiredArgsConstructor
@Slf4j
public class ConversationController {

    private final ConversationChatService chatService;
    private final StreamBridge streamBridge;

    @PostMapping("/{id}/chat")
    public Mono<ResponseEntity<Object>> chat(@RequestHeader(CredentialController.USER_HEADER) Long userId,
                                             @PathVariable Long id,
                                             @Valid @RequestBody ConversationChatRequest request) {
        log.info("Conversation {} chat (user {}, stream={})", id, userId, request.getStream());
        if (!Boolean.TRUE.equals(request.getStream())) {
            return chatService.chat(id, userId, request.getContent(), request.getTemperature(), request.getMaxTokens())
                    .map(result -> ResponseEntity.ok()
                            .contentType(MediaType.APPLICATION_JSON)
                            .body((Object) ChatCompletionResponse.from(result)));
        }
        return chatService.prepare(id, userId, request.getContent(), request.getTemperature(), request.getMaxTokens())
                .map(prepared -> ResponseEntity.ok()
                        .contentType(MediaType.TEXT_EVENT_STREAM)
                        .body((Object) streamBridge.toSse(chatService.streamChat(prepared), prepared.getRequest().getModel())));
    }
}
