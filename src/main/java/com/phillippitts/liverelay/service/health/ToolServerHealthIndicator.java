package com.phillippitts.liverelay.service.health;

import com.phillippitts.liverelay.service.tools.ServerStatus;
import com.phillippitts.liverelay.service.tools.ToolHostRegistry;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;

import java.util.Map;

/**
 * Health indicator for hosted tool servers.
 *
 * <ul>
 *   <li>UP: every registered server connected (or none registered)</li>
 *   <li>DEGRADED: some servers disconnected</li>
 *   <li>DOWN: servers registered but none connected</li>
 * </ul>
 */
public class ToolServerHealthIndicator implements HealthIndicator {

    private final ToolHostRegistry registry;

    public ToolServerHealthIndicator(ToolHostRegistry registry) {
        this.registry = registry;
    }

    @Override
    public Health health() {
        Map<String, ServerStatus> all = registry.getStatus();
        long connected = all.values().stream().filter(ServerStatus::connected).count();

        Health.Builder builder = new Health.Builder();
        if (all.isEmpty()) {
            builder.up().withDetail("status", "No tool servers registered");
        } else if (connected == all.size()) {
            builder.up().withDetail("status", "All tool servers connected");
        } else if (connected > 0) {
            builder.status("DEGRADED").withDetail("status", "Some tool servers disconnected");
        } else {
            builder.down().withDetail("status", "No tool servers connected");
        }
        for (Map.Entry<String, ServerStatus> e : all.entrySet()) {
            ServerStatus s = e.getValue();
            builder.withDetail(e.getKey(), s.connected() ? "connected (" + s.toolCount() + " tools)" : "disconnected");
        }
        return builder.build();
    }
}
