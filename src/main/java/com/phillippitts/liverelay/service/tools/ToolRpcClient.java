package com.phillippitts.liverelay.service.tools;

import com.phillippitts.liverelay.config.properties.ToolHostProperties;
import com.phillippitts.liverelay.exception.ToolRpcException;
import com.phillippitts.liverelay.exception.ToolRpcExceptionBuilder;
import com.phillippitts.liverelay.util.LogSanitizer;
import com.phillippitts.liverelay.util.ProcessTimeouts;
import com.phillippitts.liverelay.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

/**
 * JSON-RPC 2.0 client for one tool server child process speaking line-delimited JSON over
 * stdin/stdout.
 *
 * <p>Responsibilities:
 * <ul>
 *   <li>Start the process via {@link ToolProcessFactory} and run the initialize handshake</li>
 *   <li>Correlate responses by request id; ids strictly increase and are never reused</li>
 *   <li>Enforce the request timeout; lines for other ids and server-initiated messages are
 *       discarded</li>
 *   <li>Drain stderr continuously so the child never blocks on a full pipe</li>
 *   <li>Idempotent {@link #disconnect()}: graceful termination, then a forced kill</li>
 * </ul>
 *
 * <p><b>Thread Safety:</b> requests are serialized by a lock, so at most one is in flight.
 * {@link #connect()} and {@link #disconnect()} are synchronized with each other.
 */
public class ToolRpcClient {

    private static final Logger LOG = LogManager.getLogger(ToolRpcClient.class);

    static final String MDC_SERVER = "toolServer";

    /** Item of the stdout line queue; {@link #EOF} marks the closed pipe. */
    private record StdoutLine(String text) {
        static final StdoutLine EOF = new StdoutLine(null);
    }

    private final String serverName;
    private final List<String> command;
    private final Map<String, String> env;
    private final ToolProcessFactory processFactory;
    private final ToolHostProperties props;

    private final AtomicLong requestIds = new AtomicLong();
    private final ReentrantLock requestLock = new ReentrantLock();

    private volatile Process process;
    private volatile BufferedWriter stdin;
    private volatile LinkedBlockingQueue<StdoutLine> stdoutLines;
    private volatile Thread outReader;
    private volatile Thread errReader;
    private volatile boolean connected;
    private volatile List<ToolDescriptor> tools = List.of();

    public ToolRpcClient(String serverName,
                         String command,
                         List<String> args,
                         Map<String, String> env,
                         ToolProcessFactory processFactory,
                         ToolHostProperties props) {
        this.serverName = Objects.requireNonNull(serverName, "serverName");
        Objects.requireNonNull(command, "command");
        List<String> cmd = new ArrayList<>();
        cmd.add(command);
        if (args != null) {
            cmd.addAll(args);
        }
        this.command = List.copyOf(cmd);
        this.env = env == null ? Map.of() : Map.copyOf(env);
        this.processFactory = Objects.requireNonNull(processFactory, "processFactory");
        this.props = Objects.requireNonNull(props, "props");
    }

    public String getServerName() {
        return serverName;
    }

    public boolean isConnected() {
        return connected;
    }

    /** Tools from the last successful catalog listing. */
    public List<ToolDescriptor> getTools() {
        return tools;
    }

    /**
     * Starts the process, performs the initialize handshake and lists the tools.
     *
     * @return {@code true} when connected; on failure the process is terminated and the
     *         client stays disconnected
     */
    public synchronized boolean connect() {
        if (connected) {
            return true;
        }
        ThreadContext.put(MDC_SERVER, serverName);
        long start = System.nanoTime();
        try {
            startProcess();
            JSONObject init = request(JsonRpcMessages.INITIALIZE, JsonRpcMessages.initializeParams(
                    props.getProtocolVersion(), props.getClientName(), props.getClientVersion()));
            if (!init.has("result")) {
                throw ToolRpcExceptionBuilder.create("Failed to initialize")
                        .server(serverName)
                        .metadata("response", LogSanitizer.truncate(init.toString(), 200))
                        .build();
            }
            connected = true;
            sendNotification(JsonRpcMessages.INITIALIZED);
            listTools();
            LOG.info("Connected to tool server '{}': tools={}, durationMs={}",
                    serverName, tools.size(), TimeUtils.elapsedMillis(start));
            return true;
        } catch (IOException | ToolRpcException e) {
            LOG.error("Error connecting to tool server '{}': {}", serverName, e.getMessage());
            disconnect();
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Interrupted while connecting to tool server '{}'", serverName);
            disconnect();
            return false;
        } finally {
            ThreadContext.remove(MDC_SERVER);
        }
    }

    /**
     * Requests the tool catalog and stores it.
     *
     * @return the tools, or an empty list when the request fails or the response has no result
     */
    public List<ToolDescriptor> listTools() throws InterruptedException {
        try {
            JSONObject response = request(JsonRpcMessages.TOOLS_LIST, null);
            JSONObject result = response.optJSONObject("result");
            if (result == null) {
                LOG.error("Failed to list tools from '{}': {}", serverName,
                        LogSanitizer.truncate(response.toString(), 200));
                return List.of();
            }
            List<ToolDescriptor> listed = new ArrayList<>();
            JSONArray entries = result.optJSONArray("tools");
            if (entries != null) {
                for (int i = 0; i < entries.length(); i++) {
                    JSONObject entry = entries.optJSONObject(i);
                    ToolDescriptor descriptor = entry == null ? null : ToolDescriptor.fromCatalogEntry(serverName, entry);
                    if (descriptor != null) {
                        listed.add(descriptor);
                    }
                }
            }
            tools = List.copyOf(listed);
            return tools;
        } catch (ToolRpcException e) {
            LOG.error("Error listing tools from '{}': {}", serverName, e.getMessage());
            return List.of();
        }
    }

    /**
     * Invokes a tool. Transport errors are reported in the envelope, never thrown.
     */
    public ToolResult executeTool(String toolName, JSONObject arguments) {
        ThreadContext.put(MDC_SERVER, serverName);
        try {
            JSONObject response = request(JsonRpcMessages.TOOLS_CALL,
                    JsonRpcMessages.callParams(toolName, arguments));
            if (response.has("result")) {
                return ToolResult.success(response.get("result"), serverName, toolName);
            }
            JSONObject error = response.optJSONObject("error");
            if (error != null) {
                return ToolResult.failure(error.optString("message", "Unknown error"), serverName, toolName);
            }
            return ToolResult.failure("Invalid response from server", serverName, toolName);
        } catch (ToolRpcException e) {
            LOG.warn("Tool call {}/{} failed: {}", serverName, toolName, e.getMessage());
            return ToolResult.failure(e.getMessage(), serverName, toolName);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ToolResult.failure("Interrupted", serverName, toolName);
        } finally {
            ThreadContext.remove(MDC_SERVER);
        }
    }

    public ServerStatus getStatus() {
        List<ToolDescriptor> current = tools;
        List<String> names = new ArrayList<>(current.size());
        for (ToolDescriptor d : current) {
            names.add(d.name());
        }
        return new ServerStatus(serverName, connected, current.size(), names);
    }

    /**
     * Terminates the process (graceful, then forced) and clears all connection state.
     * Idempotent.
     */
    public synchronized void disconnect() {
        Process p = this.process;
        this.process = null;
        this.connected = false;
        this.tools = List.of();
        BufferedWriter writer = this.stdin;
        this.stdin = null;
        if (writer != null) {
            try {
                writer.close();
            } catch (IOException e) {
                LOG.debug("Closing stdin of '{}' failed: {}", serverName, e.toString());
            }
        }
        if (p != null) {
            destroyProcess(p);
            LOG.info("Disconnected from tool server '{}'", serverName);
        }
        joinQuietly(outReader);
        joinQuietly(errReader);
        outReader = null;
        errReader = null;
    }

    private void startProcess() throws IOException {
        Process p = processFactory.start(command, env);
        LinkedBlockingQueue<StdoutLine> lines = new LinkedBlockingQueue<>();
        this.stdoutLines = lines;
        this.stdin = new BufferedWriter(new OutputStreamWriter(p.getOutputStream(), StandardCharsets.UTF_8));
        this.process = p;
        this.outReader = startReader(p.getInputStream(), "tool-out-" + serverName, line -> lines.offer(new StdoutLine(line)),
                () -> {
                    lines.offer(StdoutLine.EOF);
                    if (connected && process == p) {
                        LOG.warn("Tool server '{}' closed its output; marking disconnected", serverName);
                        connected = false;
                    }
                });
        this.errReader = startReader(p.getErrorStream(), "tool-err-" + serverName,
                line -> LOG.debug("[{} stderr] {}", serverName, line), () -> { });
        LOG.debug("Started tool server '{}': {}", serverName, command);
    }

    /**
     * Sends one request and waits for the response with the same id.
     */
    JSONObject request(String method, JSONObject params) throws InterruptedException {
        BufferedWriter writer = this.stdin;
        LinkedBlockingQueue<StdoutLine> lines = this.stdoutLines;
        if (process == null || writer == null || lines == null) {
            throw ToolRpcExceptionBuilder.create("Server process not started")
                    .server(serverName)
                    .method(method)
                    .build();
        }
        requestLock.lockInterruptibly();
        try {
            PendingRequest pending = PendingRequest.issue(requestIds.incrementAndGet(), method);
            long start = System.nanoTime();
            write(writer, JsonRpcMessages.request(pending.id(), method, params), pending);
            return awaitResponse(lines, pending, start);
        } finally {
            requestLock.unlock();
        }
    }

    private JSONObject awaitResponse(LinkedBlockingQueue<StdoutLine> lines, PendingRequest pending, long start)
            throws InterruptedException {
        long timeoutNanos = TimeUnit.MILLISECONDS.toNanos(props.getRequestTimeoutMs());
        long deadline = start + timeoutNanos;
        while (true) {
            long remaining = deadline - System.nanoTime();
            StdoutLine line = remaining > 0 ? lines.poll(remaining, TimeUnit.NANOSECONDS) : null;
            if (line == null) {
                throw failure("Request timeout", pending, start);
            }
            if (line == StdoutLine.EOF) {
                // Keep the marker for later requests
                lines.offer(StdoutLine.EOF);
                throw failure("No response from server", pending, start);
            }
            JSONObject message;
            try {
                message = new JSONObject(line.text());
            } catch (JSONException e) {
                throw ToolRpcExceptionBuilder.create("Malformed response")
                        .server(serverName)
                        .method(pending.method())
                        .requestId(pending.id())
                        .cause(e)
                        .metadata("line", LogSanitizer.truncate(line.text(), 120))
                        .build();
            }
            long id = JsonRpcMessages.responseId(message);
            if (id == pending.id()) {
                LOG.debug("{} #{} answered in {}ms", pending.method(), id, TimeUtils.elapsedMillis(start));
                return message;
            }
            LOG.debug("Discarding message from '{}' while awaiting #{}: {}", serverName, pending.id(),
                    LogSanitizer.truncate(line.text(), 120));
        }
    }

    private void sendNotification(String method) throws IOException {
        BufferedWriter writer = this.stdin;
        if (writer == null) {
            return;
        }
        requestLock.lock();
        try {
            writer.write(JsonRpcMessages.notification(method));
            writer.newLine();
            writer.flush();
        } finally {
            requestLock.unlock();
        }
    }

    private void write(BufferedWriter writer, String json, PendingRequest pending) {
        try {
            writer.write(json);
            writer.newLine();
            writer.flush();
        } catch (IOException e) {
            throw ToolRpcExceptionBuilder.create("Request failed: " + e.getMessage())
                    .server(serverName)
                    .method(pending.method())
                    .requestId(pending.id())
                    .cause(e)
                    .build();
        }
    }

    private ToolRpcException failure(String message, PendingRequest pending, long start) {
        return ToolRpcExceptionBuilder.create(message)
                .server(serverName)
                .method(pending.method())
                .requestId(pending.id())
                .durationMs(TimeUtils.elapsedMillis(start))
                .build();
    }

    private static Thread startReader(InputStream in, String name,
                                      Consumer<String> onLine, Runnable onEnd) {
        Thread thread = new Thread(() -> {
            try (BufferedReader br = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
                String line;
                while ((line = br.readLine()) != null) {
                    onLine.accept(line);
                }
            } catch (IOException e) {
                LOG.debug("Reader '{}' stopped: {}", name, e.toString());
            } finally {
                onEnd.run();
            }
        }, name);
        thread.setDaemon(true);
        thread.start();
        return thread;
    }

    private void destroyProcess(Process p) {
        try {
            p.destroy();
            boolean exited = p.waitFor(props.getShutdownTimeoutMs(), TimeUnit.MILLISECONDS);
            if (!exited && p.isAlive()) {
                LOG.warn("Tool server '{}' ignored termination for {}ms; killing", serverName,
                        props.getShutdownTimeoutMs());
                p.destroyForcibly();
                p.waitFor(ProcessTimeouts.FORCEFUL_SHUTDOWN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
                if (p.isAlive()) {
                    LOG.warn("Tool server '{}' still alive after destroyForcibly", serverName);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            p.destroyForcibly();
            LOG.warn("Interrupted while stopping tool server '{}'", serverName);
        }
    }

    private static void joinQuietly(Thread thread) {
        if (thread == null || thread == Thread.currentThread()) {
            return;
        }
        Duration timeout = ProcessTimeouts.READER_JOIN_TIMEOUT;
        try {
            thread.join(timeout.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
