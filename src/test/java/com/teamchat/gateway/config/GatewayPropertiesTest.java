package com.teamchat.gateway.config;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class GatewayPropertiesTest {

    @Test
    void defaults_ShouldApplyWhenUnset() {
        GatewayProperties props = new GatewayProperties(null, null, null, null, null, null);

        assertThat(props.hostEffective()).isEqualTo("0.0.0.0");
        assertThat(props.portEffective()).isEqualTo(9001);
        assertThat(props.pathEffective()).isEqualTo("/ws");
        assertThat(props.readerIdleSecondsEffective()).isEqualTo(90);
        assertThat(props.maxFrameBytesEffective()).isEqualTo(65536);
        assertThat(props.instanceIdEffective()).startsWith("gw-");
    }

    @Test
    void instanceId_ShouldFallBackToHostAndPort() {
        assertThat(new GatewayProperties("10.0.0.5", 9100, "socket", null, null, null).instanceIdEffective())
                .isEqualTo("10.0.0.5:9100");
        assertThat(new GatewayProperties(null, 9100, "socket", " gw-7 ", null, null).instanceIdEffective())
                .isEqualTo("gw-7");
        assertThat(new GatewayProperties(null, null, "socket", null, null, null).pathEffective())
                .isEqualTo("/socket");
    }
}
