package com.llmhub.gateway.core.router;

import com.llmhub.gateway.core.model.ProviderType;

/**
 * 模型名 -> provider 的映射规则
 */
public interface ProviderResolutionPolicy {

    ProviderType resolve(String model);
}
