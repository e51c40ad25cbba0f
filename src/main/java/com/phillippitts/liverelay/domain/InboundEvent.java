package com.phillippitts.liverelay.domain;

import java.util.Objects;

/**
 * Event produced by the session receive loop.
 */
public sealed interface InboundEvent
        permits InboundEvent.AudioData, InboundEvent.TextDelta, InboundEvent.TurnComplete {

    /** Streamed model audio (PCM 24 kHz, 16-bit mono). */
    record AudioData(byte[] pcm) implements InboundEvent {
        public AudioData {
            Objects.requireNonNull(pcm, "pcm must not be null");
        }
    }

    /** Incremental model text. */
    record TextDelta(String text) implements InboundEvent {
        public TextDelta {
            Objects.requireNonNull(text, "text must not be null");
        }
    }

    /** End of the current model turn (also sent when the user interrupts the model). */
    final class TurnComplete implements InboundEvent {
        public static final TurnComplete INSTANCE = new TurnComplete();

        private TurnComplete() {
        }

        @Override
        public String toString() {
            return "TurnComplete";
        }
    }
}
