package com.phillippitts.liverelay.domain;

/**
 * Unit placed on the pipeline's bounded outbound queue.
 *
 * <p>The hierarchy is closed: an item is either an {@link AudioChunk} (microphone PCM) or a
 * {@link MediaFrame} (encoded image). Routing to the session is decided by type alone.
 */
public sealed interface OutboundItem permits AudioChunk, MediaFrame {
}
