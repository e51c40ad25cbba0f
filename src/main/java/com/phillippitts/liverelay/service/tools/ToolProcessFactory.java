package com.phillippitts.liverelay.service.tools;

import java.io.IOException;
import java.util.List;
import java.util.Map;

/**
 * Abstraction over {@link ProcessBuilder} to enable hermetic testing of tool server clients.
 *
 * <p>Production code uses {@link DefaultToolProcessFactory}. Tests provide a stub that returns a
 * fake {@link Process} speaking scripted JSON-RPC.
 */
public interface ToolProcessFactory {

    /**
     * Starts a tool server.
     *
     * @param command executable followed by its arguments
     * @param env variables added to (or overriding) the inherited environment
     * @return started process with piped stdin, stdout and stderr
     * @throws IOException if the process cannot be started
     */
    Process start(List<String> command, Map<String, String> env) throws IOException;
}
