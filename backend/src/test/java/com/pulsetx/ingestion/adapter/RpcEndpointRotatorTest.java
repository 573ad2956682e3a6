package com.pulsetx.ingestion.adapter;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RpcEndpointRotatorTest {

    @Test
    void getNextEndpoint_roundRobins() {
        RpcEndpointRotator rotator = new RpcEndpointRotator(
                List.of("https://a.com", "https://b.com", "https://c.com"));
        assertThat(rotator.getNextEndpoint()).isEqualTo("https://a.com");
        assertThat(rotator.getNextEndpoint()).isEqualTo("https://b.com");
        assertThat(rotator.getNextEndpoint()).isEqualTo("https://c.com");
        assertThat(rotator.getNextEndpoint()).isEqualTo("https://a.com");
    }

    @Test
    void getNextEndpoint_singleEndpoint_alwaysSame() {
        RpcEndpointRotator rotator = new RpcEndpointRotator(List.of("https://only.com"));
        IntStream.range(0, 5).forEach(i -> assertThat(rotator.getNextEndpoint()).isEqualTo("https://only.com"));
    }

    @Test
    void constructor_emptyEndpoints_throws() {
        assertThatThrownBy(() -> new RpcEndpointRotator(List.of()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("At least one endpoint");
        assertThatThrownBy(() -> new RpcEndpointRotator(null))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
