package com.lpradar.chain;

import com.lpradar.common.RetryPolicy;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RpcEndpointRotatorTest {

    @Test
    void getNextEndpoint_roundRobins() {
        RpcEndpointRotator rotator = new RpcEndpointRotator(
                List.of("https://a.com", "https://b.com", "https://c.com"),
                RetryPolicy.defaultPolicy());
        assertThat(rotator.getNextEndpoint()).isEqualTo("https://a.com");
        assertThat(rotator.getNextEndpoint()).isEqualTo("https://b.com");
        assertThat(rotator.getNextEndpoint()).isEqualTo("https://c.com");
        assertThat(rotator.getNextEndpoint()).isEqualTo("https://a.com");
    }

    @Test
    void getNextEndpoint_singleEndpoint_alwaysSame() {
        RpcEndpointRotator rotator = new RpcEndpointRotator(List.of("https://only.com"), null);
        IntStream.range(0, 5).forEach(i -> assertThat(rotator.getNextEndpoint()).isEqualTo("https://only.com"));
    }

    @Test
    void getNextEndpoint_skipsCoolingEndpointUntilCooldownExpires() {
        AtomicLong now = new AtomicLong(1_000L);
        RpcEndpointRotator rotator = new RpcEndpointRotator(List.of("https://a.com", "https://b.com"), null, now::get);
        rotator.markCoolingDown("https://a.com", 500L);

        assertThat(rotator.getNextEndpoint()).isEqualTo("https://b.com");
        assertThat(rotator.getNextEndpoint()).isEqualTo("https://b.com");

        now.set(1_500L);
        assertThat(List.of(rotator.getNextEndpoint(), rotator.getNextEndpoint()))
                .containsExactlyInAnyOrder("https://a.com", "https://b.com");
    }

    @Test
    void getNextEndpoint_allCooling_stillReturnsAnEndpoint() {
        AtomicLong now = new AtomicLong(0L);
        RpcEndpointRotator rotator = new RpcEndpointRotator(List.of("https://a.com", "https://b.com"), null, now::get);
        rotator.markCoolingDown("https://a.com", 1_000L);
        rotator.markCoolingDown("https://b.com", 1_000L);

        assertThat(rotator.getNextEndpoint()).isIn("https://a.com", "https://b.com");
    }

    @Test
    void retryDelayMs_usesPolicy() {
        RpcEndpointRotator rotator = new RpcEndpointRotator(List.of("https://a.com"), new RetryPolicy(100L, 10_000L, 0, 3));
        assertThat(rotator.retryDelayMs(0)).isEqualTo(100L);
        assertThat(rotator.retryDelayMs(1)).isEqualTo(200L);
        assertThat(rotator.getMaxAttempts()).isEqualTo(3);
    }

    @Test
    void constructor_emptyEndpoints_throws() {
        assertThatThrownBy(() -> new RpcEndpointRotator(List.of(), null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("At least one endpoint");
        assertThatThrownBy(() -> new RpcEndpointRotator(null, null))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
