package com.phillippitts.liverelay.service.health;

import com.phillippitts.liverelay.service.tools.ServerStatus;
import com.phillippitts.liverelay.service.tools.ToolHostRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class ToolServerHealthIndicatorTest {

    private static ServerStatus connected(String name) {
        return new ServerStatus(name, true, 2, List.of("add", "echo"));
    }

    private static ServerStatus disconnected(String name) {
        return new ServerStatus(name, false, 0, List.of());
    }

    private static Health healthFor(ServerStatus... statuses) {
        ToolHostRegistry registry = mock(ToolHostRegistry.class);
        Map<String, ServerStatus> all = new LinkedHashMap<>();
        for (ServerStatus s : statuses) {
            all.put(s.server(), s);
        }
        when(registry.getStatus()).thenReturn(all);
        return new ToolServerHealthIndicator(registry).health();
    }

    @Test
    void shouldReportUpWhenNoServersRegistered() {
        Health health = healthFor();

        assertThat(health.getStatus()).isEqualTo(Status.UP);
        assertThat(health.getDetails()).containsEntry("status", "No tool servers registered");
    }

    @Test
    void shouldReportUpWhenAllServersConnected() {
        Health health = healthFor(connected("calc"), connected("weather"));

        assertThat(health.getStatus()).isEqualTo(Status.UP);
        assertThat(health.getDetails()).containsEntry("calc", "connected (2 tools)");
    }

    @Test
    void shouldReportDegradedWhenSomeServersDisconnected() {
        Health health = healthFor(connected("calc"), disconnected("weather"));

        assertThat(health.getStatus()).isEqualTo(new Status("DEGRADED"));
        assertThat(health.getDetails()).containsEntry("weather", "disconnected");
    }

    @Test
    void shouldReportDownWhenNoServerConnected() {
        Health health = healthFor(disconnected("calc"));

        assertThat(health.getStatus()).isEqualTo(Status.DOWN);
        assertThat(health.getDetails()).containsEntry("status", "No tool servers connected");
    }
}
