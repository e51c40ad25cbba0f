/**
 * Capture sources feeding the outbound queue: microphone PCM via Java Sound, camera frames via
 * JavaCV and screen frames via {@link java.awt.Robot}.
 *
 * <p>Device failures end only the failing source and are published as
 * {@link com.phillippitts.liverelay.service.capture.CaptureErrorEvent}s.
 */
package com.phillippitts.liverelay.service.capture;
