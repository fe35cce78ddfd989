package com.llmhub.gateway.core.adapter;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import org.junit.jupiter.api.Test;

import com.llmhub.gateway.core.model.ProviderType;

class PricingTableTest {

    private final PricingTable openai = PricingTable.defaultsFor(ProviderType.OPENAI);

    @Test
    void shouldChargeInputPriceForOneMillionPromptTokens() {
        // gpt-4o-mini: 0.15 / 0.6 per million
        assertThat(openai.estimateCost("gpt-4o-mini", 1_000_000, 0)).isCloseTo(0.15, within(1e-9));
    }

    @Test
    void shouldPreferLongestMatchingPrefix() {
        assertThat(openai.find("gpt-4o-mini-2024-07-18").orElseThrow().getInputPerMillion()).isEqualByComparingTo("0.15");
        assertThat(openai.find("gpt-4o-2024-05-13").orElseThrow().getInputPerMillion()).isEqualByComparingTo("5.0");
        assertThat(openai.find("gpt-4-0613").orElseThrow().getInputPerMillion()).isEqualByComparingTo("30.0");
    }

    @Test
    void shouldKeepFirstDeclarationOnDuplicatePrefix() {
        PricingTable table = PricingTable.builder()
                .add("m", "1", "1")
                .add("m", "9", "9")
                .build();

        assertThat(table.estimateCost("model", 1_000_000, 0)).isCloseTo(1.0, within(1e-9));
    }

    @Test
    void shouldReturnZeroForUnknownModel() {
        assertThat(openai.estimateCost("llama3", 5000, 5000)).isZero();
        assertThat(PricingTable.defaultsFor(ProviderType.OLLAMA).estimateCost("llama3", 5000, 5000)).isZero();
    }

    @Test
    void shouldBeMonotonicInTokenCounts() {
        double base = openai.estimateCost("gpt-4o", 1000, 1000);

        assertThat(openai.estimateCost("gpt-4o", 2000, 1000)).isGreaterThanOrEqualTo(base);
        assertThat(openai.estimateCost("gpt-4o", 1000, 2000)).isGreaterThanOrEqualTo(base);
        assertThat(base).isNotNegative();
    }

    @Test
    void shouldCombineInputAndOutputCost() {
        // Input: 1000 * 5 / 1M = 0.005, Output: 500 * 15 / 1M = 0.0075
        assertThat(openai.estimateCost("gpt-4o", 1000, 500)).isCloseTo(0.0125, within(1e-9));
    }

    @Test
    void shouldTreatNegativeTokensAsZero() {
        assertThat(openai.estimateCost("gpt-4o", -10, -10)).isZero();
    }

    @Test
    void flatTableShouldApplyToAnyModel() {
        PricingTable flat = PricingTable.flat(PricingTable.ModelPricing.of("2", "4"));

        assertThat(flat.estimateCost("whatever", 500_000, 250_000)).isCloseTo(2.0, within(1e-9));
    }
}
