package com.llmhub.gateway.core.dao;

import com.llmhub.gateway.core.model.Conversation;
import org.apache.ibatis.annotations.*;

@Mapper
public interface ConversationMapper {

    @Select("SELECT id, owner_id, credential_id, model, system_prompt FROM conversation WHERE id = #{id}")
    Conversation findById(Long id);

    // 行锁只在事务内持有，和 selectSeq 一起组成序号分配
    @Update("UPDATE conversation SET next_seq = next_seq + 1 WHERE id = #{id}")
    int incrementSeq(Long id);

    @Select("SELECT next_seq FROM conversation WHERE id = #{id}")
    Long selectSeq(Long id);
}
