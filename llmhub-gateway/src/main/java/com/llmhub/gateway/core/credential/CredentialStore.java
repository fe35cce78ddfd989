package com.llmhub.gateway.core.credential;

import com.llmhub.gateway.core.model.Credential;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;

/**
 * 凭证的持久化与查询。所有返回 Mono 的方法都不会阻塞调用线程
 */
public interface CredentialStore {

    /**
     * 按 id 读取属于 ownerId 的凭证；不存在或不属于该用户时以 ResourceNotFoundException 结束
     */
    Mono<Credential> getCredential(Long id, Long ownerId);

    /**
     * 解密存储的密钥；blob 为 null 时返回 null（本地模型不需要密钥）
     */
    String decryptSecret(String blob);

    /**
     * owner 在某个 provider 下所有 active 凭证，按 id 排序
     */
    Mono<List<Credential>> findActiveByProvider(String provider, Long ownerId);

    /**
     * 通过 bearer token 查找 active 的网关客户端凭证；找不到时为空
     */
    Mono<Credential> findGatewayClient(String token);

    Mono<Void> touch(Long credentialId);

    Mono<List<Credential>> listByOwner(Long ownerId);

    Mono<Credential> register(Long ownerId, String provider, String displayName, String secret,
                              Map<String, Object> extraConfig, Integer rateLimitRpm);

    /**
     * 参数为 null 表示保持不变
     */
    Mono<Credential> update(Long id, Long ownerId, String displayName,
                            Map<String, Object> extraConfig, Integer rateLimitRpm);

    Mono<Credential> toggle(Long id, Long ownerId);

    Mono<Void> delete(Long id, Long ownerId);
}
