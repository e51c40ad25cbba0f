/**
 * Hosting of external tool servers (Model Context Protocol) over line-delimited JSON-RPC 2.0
 * on the child process's stdin/stdout.
 *
 * <p>{@link com.phillippitts.liverelay.service.tools.ToolRpcClient} owns one child process;
 * {@link com.phillippitts.liverelay.service.tools.ToolHostRegistry} keeps the named set of clients
 * and the aggregate tool catalog. Failures of a call are returned as
 * {@link com.phillippitts.liverelay.service.tools.ToolResult} envelopes, never thrown.
 */
package com.phillippitts.liverelay.service.tools;
