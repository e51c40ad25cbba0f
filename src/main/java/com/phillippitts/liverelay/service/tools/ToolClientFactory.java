package com.phillippitts.liverelay.service.tools;

import java.util.List;
import java.util.Map;

/**
 * Creates (unconnected) clients for the registry; replaced in tests.
 */
@FunctionalInterface
public interface ToolClientFactory {

    ToolRpcClient create(String serverName, String command, List<String> args, Map<String, String> env);
}
