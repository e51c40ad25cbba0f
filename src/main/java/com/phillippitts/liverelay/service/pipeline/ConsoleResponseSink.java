package com.phillippitts.liverelay.service.pipeline;

import java.io.PrintStream;
import java.util.Objects;

/**
 * Prints model text to the console as it streams in; audio is only played locally.
 */
public class ConsoleResponseSink implements ResponseSink {

    private final PrintStream out;
    private boolean midLine;

    public ConsoleResponseSink(PrintStream out) {
        this.out = Objects.requireNonNull(out, "out");
    }

    @Override
    public void onAudio(byte[] pcm) {
        // played by the pipeline
    }

    @Override
    public synchronized void onText(String text) {
        out.print(text);
        out.flush();
        midLine = !text.endsWith("\n");
    }

    @Override
    public synchronized void onTurnComplete() {
        if (midLine) {
            out.println();
            midLine = false;
        }
    }
}
