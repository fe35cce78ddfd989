package com.llmhub.gateway.core.adapter;

import com.llmhub.gateway.core.model.ProviderType;
import lombok.Value;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * 模型名前缀 -> 单价（美元 / 百万 tokens）。
 * 匹配规则：最长前缀优先，长度相同按声明顺序
 */
public final class PricingTable {

    private static final BigDecimal ONE_MILLION = new BigDecimal("1000000");

    private final Map<String, ModelPricing> entries;

    private PricingTable(Map<String, ModelPricing> entries) {
        this.entries = Collections.unmodifiableMap(new LinkedHashMap<>(entries));
    }

    @Value
    public static class ModelPricing {
        BigDecimal inputPerMillion;
        BigDecimal outputPerMillion;

        public static ModelPricing of(String input, String output) {
            return new ModelPricing(new BigDecimal(input), new BigDecimal(output));
        }
    }

    public static PricingTable empty() {
        return new PricingTable(Map.of());
    }

    /**
     * 对所有模型生效的统一价格，用于自定义端点 / 本地模型在配置中覆盖定价
     */
    public static PricingTable flat(ModelPricing pricing) {
        return builder().add("", pricing).build();
    }

    public static PricingTable defaultsFor(ProviderType provider) {
        switch (provider) {
            case OPENAI:
                return builder()
                        .add("gpt-4", "30.0", "60.0")
                        .add("gpt-4-turbo", "10.0", "30.0")
                        .add("gpt-4o", "5.0", "15.0")
                        .add("gpt-4o-mini", "0.15", "0.6")
                        .add("gpt-3.5-turbo", "0.5", "1.5")
                        .build();
            case ANTHROPIC:
                return builder()
                        .add("claude-3-opus", "15.0", "75.0")
                        .add("claude-3-sonnet", "3.0", "15.0")
                        .add("claude-3-haiku", "0.25", "1.25")
                        .add("claude-3-5-sonnet", "3.0", "15.0")
                        .build();
            case GOOGLE:
                return builder()
                        .add("gemini-pro", "0.5", "1.5")
                        .add("gemini-pro-vision", "0.5", "1.5")
                        .add("gemini-1.5-pro", "3.5", "10.5")
                        .add("gemini-1.5-flash", "0.35", "1.05")
                        .build();
            default:
                // ollama / custom 默认免费，可在 extra_config.pricing 覆盖
                return empty();
        }
    }

    public Optional<ModelPricing> find(String model) {
        if (model == null) {
            return Optional.empty();
        }
        String bestPrefix = null;
        ModelPricing best = null;
        for (Map.Entry<String, ModelPricing> entry : entries.entrySet()) {
            String prefix = entry.getKey();
            // 严格大于：长度相同时保留先声明的
            if (model.startsWith(prefix) && (bestPrefix == null || prefix.length() > bestPrefix.length())) {
                bestPrefix = prefix;
                best = entry.getValue();
            }
        }
        return Optional.ofNullable(best);
    }

    /**
     * 估算费用，未匹配到定价返回 0.0。负数 token 按 0 处理
     */
    public double estimateCost(String model, int promptTokens, int completionTokens) {
        return find(model)
                .map(pricing -> tokenCost(promptTokens, pricing.getInputPerMillion())
                        .add(tokenCost(completionTokens, pricing.getOutputPerMillion()))
                        .doubleValue())
                .orElse(0.0);
    }

    private static BigDecimal tokenCost(int tokens, BigDecimal pricePerMillion) {
        if (tokens <= 0 || pricePerMillion == null) {
            return BigDecimal.ZERO;
        }
        return BigDecimal.valueOf(tokens)
                .multiply(pricePerMillion)
                .divide(ONE_MILLION, 6, RoundingMode.HALF_UP);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private final Map<String, ModelPricing> entries = new LinkedHashMap<>();

        public Builder add(String prefix, String inputPerMillion, String outputPerMillion) {
            return add(prefix, ModelPricing.of(inputPerMillion, outputPerMillion));
        }

        public Builder add(String prefix, ModelPricing pricing) {
            entries.putIfAbsent(prefix, pricing);
            return this;
        }

        public PricingTable build() {
            return new PricingTable(entries);
        }
    }
}
