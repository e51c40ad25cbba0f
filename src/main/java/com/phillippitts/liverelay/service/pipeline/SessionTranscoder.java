package com.phillippitts.liverelay.service.pipeline;

import com.phillippitts.liverelay.domain.AudioChunk;
import com.phillippitts.liverelay.domain.MediaFrame;
import com.phillippitts.liverelay.domain.OutboundItem;
import com.phillippitts.liverelay.service.session.LiveSession;

import java.io.IOException;

/**
 * Routes an outbound item to the matching session call by its type alone.
 */
public class SessionTranscoder {

    public void forward(OutboundItem item, LiveSession session) throws IOException, InterruptedException {
        if (item instanceof AudioChunk chunk) {
            session.sendAudio(chunk);
        } else if (item instanceof MediaFrame frame) {
            session.sendMedia(frame);
        } else {
            throw new IllegalArgumentException("Unsupported outbound item: " + item);
        }
    }
}
