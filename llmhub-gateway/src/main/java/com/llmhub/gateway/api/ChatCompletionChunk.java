package com.llmhub.gateway.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 流式响应的单个分片 (object = chat.completion.chunk)
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChatCompletionChunk {

    private String id;
    private String object;
    private Long created;
    private String model;
    private List<Choice> choices;

    public static ChatCompletionChunk of(String id, long created, String model, String content, String finishReason) {
        return ChatCompletionChunk.builder()
                .id(id)
                .object("chat.completion.chunk")
                .created(created)
                .model(model)
                .choices(List.of(new Choice(0, new Delta(content), finishReason)))
                .build();
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Choice {
        private Integer index;
        private Delta delta;

        // 中间分片为 null，需要显式输出
        @JsonProperty("finish_reason")
        private String finishReason;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class Delta {
        private String content;
    }
}
