package com.phillippitts.liverelay.service.channel;

import com.phillippitts.liverelay.exception.LiveRelayException;

/**
 * Thrown by {@link BoundedChannel#put(Object)} once the channel has been closed.
 * Pipeline tasks treat it as cancellation, not as a failure.
 */
public class ChannelClosedException extends LiveRelayException {

    public ChannelClosedException(String channelName) {
        super("Channel closed: " + channelName);
    }
}
