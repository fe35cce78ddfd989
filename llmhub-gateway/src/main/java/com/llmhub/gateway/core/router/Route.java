package com.llmhub.gateway.core.router;

import com.llmhub.gateway.core.adapter.ProviderAdapter;
import com.llmhub.gateway.core.model.Credential;
import com.llmhub.gateway.core.model.ProviderType;
import lombok.Value;

/**
 * 一次路由的结果：已选中的凭证和为其构建的适配器
 */
@Value
public class Route {
    ProviderType provider;
    Credential credential;
    ProviderAdapter adapter;
}
