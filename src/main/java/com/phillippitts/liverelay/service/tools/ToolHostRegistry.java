package com.phillippitts.liverelay.service.tools;

import com.phillippitts.liverelay.service.metrics.ToolCallMetrics;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONObject;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Named collection of tool server connections with an aggregate tool registry keyed
 * {@code "{server}_{tool}"}.
 *
 * <p>Map updates happen under the registry's monitor; connecting, invoking and disconnecting
 * happen outside it, so a slow server never blocks calls to the others.
 *
 * @since 1.0
 */
public class ToolHostRegistry {

    private static final Logger LOG = LogManager.getLogger(ToolHostRegistry.class);

    private final ToolClientFactory clientFactory;
    private final ToolCallMetrics metrics;

    private final Map<String, ToolRpcClient> servers = new LinkedHashMap<>();
    private Map<String, ToolDescriptor> registry = Map.of();

    public ToolHostRegistry(ToolClientFactory clientFactory, ToolCallMetrics metrics) {
        this.clientFactory = Objects.requireNonNull(clientFactory, "clientFactory");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    /**
     * Connects a new server and registers its tools.
     *
     * @return success with the server's catalog, or a failure; a failure changes nothing
     */
    public RegistryResult addServer(String name, String command, List<String> args, Map<String, String> env) {
        if (name == null || name.isBlank()) {
            metrics.recordRegistration("rejected");
            return RegistryResult.failure("Server name must not be blank");
        }
        if (command == null || command.isBlank()) {
            metrics.recordRegistration("rejected");
            return RegistryResult.failure("Server command must not be blank");
        }
        synchronized (this) {
            ToolRpcClient existing = servers.get(name);
            if (existing != null && existing.isConnected()) {
                metrics.recordRegistration("rejected");
                return RegistryResult.failure("Server " + name + " already connected");
            }
        }

        ToolRpcClient client = clientFactory.create(name, command, args, env);
        if (!client.connect()) {
            metrics.recordRegistration("failed");
            return RegistryResult.failure("Failed to connect to " + name);
        }

        ToolRpcClient replaced;
        synchronized (this) {
            ToolRpcClient existing = servers.get(name);
            if (existing != null && existing.isConnected()) {
                // Another add of the same name won the race
                replaced = client;
            } else {
                replaced = existing;
                servers.put(name, client);
                rebuildRegistry();
            }
        }
        if (replaced == client) {
            client.disconnect();
            metrics.recordRegistration("rejected");
            return RegistryResult.failure("Server " + name + " already connected");
        }
        if (replaced != null) {
            replaced.disconnect();
        }
        metrics.recordRegistration("added");
        LOG.info("Tool server '{}' added with {} tools", name, client.getTools().size());
        return RegistryResult.added(name, client.getTools());
    }

    /**
     * Disconnects and forgets a server.
     */
    public RegistryResult removeServer(String name) {
        ToolRpcClient client;
        synchronized (this) {
            client = servers.remove(name);
            if (client == null) {
                return RegistryResult.failure("Server " + name + " not found");
            }
            rebuildRegistry();
        }
        client.disconnect();
        LOG.info("Tool server '{}' removed", name);
        return RegistryResult.removed();
    }

    /**
     * Invokes a tool. Unknown or disconnected servers fail immediately without any I/O.
     */
    public ToolResult executeTool(String server, String tool, JSONObject params) {
        ToolRpcClient client;
        synchronized (this) {
            client = servers.get(server);
        }
        if (client == null) {
            metrics.incrementFailure(String.valueOf(server), "not_connected");
            return ToolResult.failure("Server " + server + " not connected", server, tool);
        }
        if (!client.isConnected()) {
            metrics.incrementFailure(server, "not_connected");
            return ToolResult.failure("Server " + server + " is not connected", server, tool);
        }
        long start = System.nanoTime();
        ToolResult result = client.executeTool(tool, params == null ? new JSONObject() : params);
        metrics.recordLatency(server, System.nanoTime() - start);
        if (result.success()) {
            metrics.incrementSuccess(server);
        } else {
            metrics.incrementFailure(server, "error");
        }
        return result;
    }

    /** Aggregate registry, in server registration order. */
    public synchronized Map<String, ToolDescriptor> getAllTools() {
        return registry;
    }

    public synchronized Optional<List<ToolDescriptor>> getServerTools(String name) {
        ToolRpcClient client = servers.get(name);
        return client == null ? Optional.empty() : Optional.of(client.getTools());
    }

    public synchronized Optional<ServerStatus> getStatus(String name) {
        ToolRpcClient client = servers.get(name);
        return client == null ? Optional.empty() : Optional.of(client.getStatus());
    }

    public synchronized Map<String, ServerStatus> getStatus() {
        Map<String, ServerStatus> all = new LinkedHashMap<>();
        for (Map.Entry<String, ToolRpcClient> e : servers.entrySet()) {
            all.put(e.getKey(), e.getValue().getStatus());
        }
        return Collections.unmodifiableMap(all);
    }

    /**
     * Disconnects every server. Called on application shutdown.
     */
    public void shutdown() {
        List<ToolRpcClient> clients;
        synchronized (this) {
            clients = new ArrayList<>(servers.values());
            servers.clear();
            registry = Map.of();
        }
        for (ToolRpcClient client : clients) {
            client.disconnect();
        }
        if (!clients.isEmpty()) {
            LOG.info("Disconnected {} tool servers", clients.size());
        }
    }

    private void rebuildRegistry() {
        Map<String, ToolDescriptor> rebuilt = new LinkedHashMap<>();
        for (ToolRpcClient client : servers.values()) {
            for (ToolDescriptor tool : client.getTools()) {
                rebuilt.put(tool.registryKey(), tool);
            }
        }
        registry = Collections.unmodifiableMap(rebuilt);
    }
}
