package com.llmhub.gateway.core.dao;

import com.llmhub.gateway.core.model.MessageRecord;
import org.apache.ibatis.annotations.*;

import java.util.List;

@Mapper
public interface MessageMapper {

    @Insert("""
        INSERT INTO message (conversation_id, seq, role, content, prompt_tokens, completion_tokens,
                             total_tokens, cost, metadata, created_at)
        VALUES (#{conversationId}, #{seq}, #{role}, #{content}, #{promptTokens}, #{completionTokens},
                #{totalTokens}, #{cost},
                #{metadata,typeHandler=com.llmhub.gateway.core.dao.JsonMapTypeHandler}, #{createdAt})
    """)
    @Options(useGeneratedKeys = true, keyProperty = "id")
    int insert(MessageRecord message);

    @Select("SELECT * FROM message WHERE conversation_id = #{conversationId} ORDER BY seq")
    @Results(id = "messageResult", value = {
            @Result(column = "id", property = "id", id = true),
            @Result(column = "metadata", property = "metadata", typeHandler = JsonMapTypeHandler.class)
    })
    List<MessageRecord> findByConversation(Long conversationId);
}
