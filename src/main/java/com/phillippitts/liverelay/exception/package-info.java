/**
 * Application-specific exception hierarchy.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.liverelay.exception.LiveRelayException} - Base exception
 *       for all application-specific errors</li>
 *   <li>{@link com.phillippitts.liverelay.exception.ToolRpcException} - Thrown when a JSON-RPC
 *       exchange with a tool server fails (not started, timeout, closed pipe, malformed line)</li>
 *   <li>{@link com.phillippitts.liverelay.exception.SessionException} - Thrown when the realtime
 *       AI session cannot be opened or fails</li>
 *   <li>{@link com.phillippitts.liverelay.exception.InvalidCommandException} - Thrown when a
 *       controller command line cannot be decoded</li>
 * </ul>
 *
 * <p>None of these cross a component boundary raw: the tool host converts them into result
 * envelopes and the command relay converts them into {@code error} events.
 *
 * @since 1.0
 */
package com.phillippitts.liverelay.exception;
