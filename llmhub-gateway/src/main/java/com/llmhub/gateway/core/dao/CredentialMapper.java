package com.llmhub.gateway.core.dao;

import com.llmhub.gateway.core.model.Credential;
import org.apache.ibatis.annotations.*;

import java.time.LocalDateTime;
import java.util.List;

@Mapper
public interface CredentialMapper {

    @Select("SELECT * FROM credential WHERE id = #{id}")
    @Results(id = "credentialResult", value = {
            @Result(column = "id", property = "id", id = true),
            @Result(column = "extra_config", property = "extraConfig", typeHandler = JsonMapTypeHandler.class)
    })
    Credential findById(Long id);

    @Select("SELECT * FROM credential WHERE owner_id = #{ownerId} ORDER BY id")
    @ResultMap("credentialResult")
    List<Credential> findByOwner(Long ownerId);

    @Select("""
        SELECT * FROM credential
        WHERE owner_id = #{ownerId} AND provider = #{provider} AND is_active = TRUE
        ORDER BY id
    """)
    @ResultMap("credentialResult")
    List<Credential> findActiveByProvider(@Param("ownerId") Long ownerId, @Param("provider") String provider);

    // secret_hash 只对 gateway_client 写入
    @Select("""
        SELECT * FROM credential
        WHERE secret_hash = #{secretHash} AND provider = 'gateway_client' AND is_active = TRUE
    """)
    @ResultMap("credentialResult")
    Credential findGatewayClientByHash(String secretHash);

    @Insert("""
        INSERT INTO credential (owner_id, provider, display_name, secret, secret_hash, extra_config,
                                is_active, rate_limit_rpm, created_at, updated_at)
        VALUES (#{ownerId}, #{provider}, #{displayName}, #{secret}, #{secretHash},
                #{extraConfig,typeHandler=com.llmhub.gateway.core.dao.JsonMapTypeHandler},
                #{isActive}, #{rateLimitRpm}, #{createdAt}, #{updatedAt})
    """)
    @Options(useGeneratedKeys = true, keyProperty = "id")
    int insert(Credential credential);

    @Update("""
        UPDATE credential
        SET display_name = #{displayName},
            extra_config = #{extraConfig,typeHandler=com.llmhub.gateway.core.dao.JsonMapTypeHandler},
            rate_limit_rpm = #{rateLimitRpm},
            updated_at = #{updatedAt}
        WHERE id = #{id}
    """)
    int update(Credential credential);

    @Update("UPDATE credential SET is_active = #{isActive}, updated_at = #{updatedAt} WHERE id = #{id}")
    int updateStatus(@Param("id") Long id, @Param("isActive") Boolean isActive,
                     @Param("updatedAt") LocalDateTime updatedAt);

    @Update("UPDATE credential SET last_used_at = #{lastUsedAt} WHERE id = #{id}")
    int touch(@Param("id") Long id, @Param("lastUsedAt") LocalDateTime lastUsedAt);

    @Delete("DELETE FROM credential WHERE id = #{id}")
    int delete(Long id);
}
