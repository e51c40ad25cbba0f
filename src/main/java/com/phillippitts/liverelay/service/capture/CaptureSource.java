package com.phillippitts.liverelay.service.capture;

import com.phillippitts.liverelay.domain.OutboundItem;
import com.phillippitts.liverelay.service.channel.BoundedChannel;

/**
 * Producer task feeding the pipeline's outbound queue.
 *
 * <p>{@link #run(BoundedChannel)} produces until the device reports end-of-stream, a device
 * error occurs, or the calling thread is interrupted. Device errors are reported as a
 * {@link CaptureErrorEvent} and end only this source; the method then returns normally.
 */
public interface CaptureSource {

    /** Short name used in logs and events, e.g. {@code microphone}. */
    String name();

    /**
     * Produces items into {@code out}.
     *
     * @throws InterruptedException when cancelled while waiting on the channel or the device
     */
    void run(BoundedChannel<OutboundItem> out) throws InterruptedException;
}
