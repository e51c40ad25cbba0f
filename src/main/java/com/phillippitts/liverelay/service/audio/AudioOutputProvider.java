package com.phillippitts.liverelay.service.audio;

import java.io.IOException;

/**
 * Opens a playback device (abstracted for tests).
 */
@FunctionalInterface
public interface AudioOutputProvider {

    AudioOutput open() throws IOException;
}
