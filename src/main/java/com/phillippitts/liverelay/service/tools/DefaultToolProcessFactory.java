package com.phillippitts.liverelay.service.tools;

import java.io.IOException;
import java.util.List;
import java.util.Map;

/**
 * Default production implementation of {@link ToolProcessFactory} using {@link ProcessBuilder}.
 */
public final class DefaultToolProcessFactory implements ToolProcessFactory {

    @Override
    public Process start(List<String> command, Map<String, String> env) throws IOException {
        ProcessBuilder pb = new ProcessBuilder(command);
        if (env != null && !env.isEmpty()) {
            pb.environment().putAll(env);
        }
        // stderr is drained separately and must never mix into the JSON-RPC stream
        pb.redirectErrorStream(false);
        return pb.start();
    }
}
