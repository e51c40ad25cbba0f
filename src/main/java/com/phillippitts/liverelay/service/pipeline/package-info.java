/**
 * The streaming pipeline: capture sources feed a bounded outbound queue drained into the live
 * session, while model turns flow back into a playback queue and a {@link
 * com.phillippitts.liverelay.service.pipeline.ResponseSink}.
 *
 * <h2>Lifecycle</h2>
 * <pre>
 * IDLE → STARTING → RUNNING → STOPPING → IDLE
 * </pre>
 * A failed start returns to IDLE. The intake task is primary: when it ends, or when any task
 * fails, every other task is cancelled and the session closed.
 *
 * <h2>Interrupt</h2>
 * {@link com.phillippitts.liverelay.service.pipeline.StreamPipeline#interrupt()} discards queued
 * playback audio; it happens at every turn end and on controller request.
 */
package com.phillippitts.liverelay.service.pipeline;
