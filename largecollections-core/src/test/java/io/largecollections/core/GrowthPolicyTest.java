package io.largecollections.core;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GrowthPolicyTest {

    @Test
    void shouldGrowMultiplicativelyBelowLimit() {
        GrowthPolicy policy = new GrowthPolicy(1.4, 100L, 50L);

        assertThat(policy.grow(0L, 1_000L)).isEqualTo(1L);
        assertThat(policy.grow(1L, 1_000L)).isEqualTo(2L);
        assertThat(policy.grow(12L, 1_000L)).isEqualTo(17L);
        assertThat(policy.grow(49L, 1_000L)).isEqualTo(69L);
    }

    @Test
    void shouldGrowAdditivelyAtOrAboveLimit() {
        GrowthPolicy policy = new GrowthPolicy(1.4, 100L, 50L);

        assertThat(policy.grow(50L, 1_000L)).isEqualTo(150L);
        assertThat(policy.grow(500L, 1_000L)).isEqualTo(600L);
    }

    @Test
    void shouldClampToMaximum() {
        GrowthPolicy policy = new GrowthPolicy(3.0, 100L, 50L);

        assertThat(policy.grow(40L, 100L)).isEqualTo(100L);
        assertThat(policy.grow(950L, 1_000L)).isEqualTo(1_000L);
        assertThat(policy.grow(1_000L, 1_000L)).isEqualTo(1_000L);
    }

    @Test
    void shouldNotOverflowNearLongMaximum() {
        GrowthPolicy policy = new GrowthPolicy(1.4, Long.MAX_VALUE, 1L);

        assertThat(policy.grow(10L, Long.MAX_VALUE)).isEqualTo(Long.MAX_VALUE);
    }

    @Test
    void shouldExposeReferenceDefaults() {
        GrowthPolicy policy = GrowthPolicy.defaultPolicy();

        assertThat(policy.growFactor()).isEqualTo(1.4);
        assertThat(policy.fixedGrowAmount()).isEqualTo(100L * 1024L * 1024L);
        assertThat(policy.fixedGrowLimit()).isEqualTo(50L * 1024L * 1024L);
    }

    @Test
    void shouldRejectInvalidParameters() {
        assertThatThrownBy(() -> new GrowthPolicy(1.0, 1L, 1L))
                .isInstanceOf(InvalidConfigurationException.class);
        assertThatThrownBy(() -> new GrowthPolicy(3.5, 1L, 1L))
                .isInstanceOf(InvalidConfigurationException.class);
        assertThatThrownBy(() -> new GrowthPolicy(Double.NaN, 1L, 1L))
                .isInstanceOf(InvalidConfigurationException.class);
        assertThatThrownBy(() -> new GrowthPolicy(1.4, 0L, 1L))
                .isInstanceOf(InvalidConfigurationException.class);
        assertThatThrownBy(() -> new GrowthPolicy(1.4, 1L, 0L))
                .isInstanceOf(InvalidConfigurationException.class);
    }
}
