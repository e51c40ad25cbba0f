/**
 * Controller mode: line-delimited JSON commands on stdin, line-delimited JSON events on stdout.
 *
 * <p>{@link com.phillippitts.liverelay.service.relay.CommandDecoder} turns each line into a
 * {@link com.phillippitts.liverelay.service.relay.ControllerCommand};
 * {@link com.phillippitts.liverelay.service.relay.CommandRelay} handles it against the pipeline
 * or the tool host registry and answers through
 * {@link com.phillippitts.liverelay.service.relay.ControllerEventWriter}.
 */
package com.phillippitts.liverelay.service.relay;
