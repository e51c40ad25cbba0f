package com.phillippitts.liverelay.service.pipeline;

import com.phillippitts.liverelay.service.channel.BlockingIo;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintStream;
import java.util.Objects;
import java.util.Optional;

/**
 * Interactive intake reading one turn per console line.
 *
 * <p>{@code q} or end of input ends the session; an empty line is sent as {@code "."} so the
 * model still gets a turn to respond to.
 */
public class ConsoleTurnIntake implements TurnIntake {

    static final String PROMPT = "message > ";
    static final String QUIT = "q";
    static final String EMPTY_TURN = ".";

    private final BufferedReader reader;
    private final PrintStream prompt;
    private final BlockingIo io;
    private volatile boolean closed;

    public ConsoleTurnIntake(BufferedReader reader, PrintStream prompt, BlockingIo io) {
        this.reader = Objects.requireNonNull(reader, "reader");
        this.prompt = Objects.requireNonNull(prompt, "prompt");
        this.io = Objects.requireNonNull(io, "io");
    }

    @Override
    public Optional<String> nextTurn() throws IOException, InterruptedException {
        if (closed) {
            return Optional.empty();
        }
        prompt.print(PROMPT);
        prompt.flush();
        String line = io.call(reader::readLine);
        if (line == null || closed) {
            return Optional.empty();
        }
        String text = line.trim();
        if (QUIT.equalsIgnoreCase(text)) {
            return Optional.empty();
        }
        return Optional.of(text.isEmpty() ? EMPTY_TURN : text);
    }

    @Override
    public void close() {
        closed = true;
    }
}
