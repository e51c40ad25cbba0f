package com.phillippitts.liverelay.cli;

import com.phillippitts.liverelay.exception.SessionException;
import com.phillippitts.liverelay.service.pipeline.ConsoleResponseSink;
import com.phillippitts.liverelay.service.pipeline.ConsoleTurnIntake;
import com.phillippitts.liverelay.service.pipeline.StreamPipeline;
import com.phillippitts.liverelay.service.pipeline.StreamPipelineFactory;
import com.phillippitts.liverelay.service.relay.CommandRelay;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Entry point behaviour after the context is up.
 *
 * <p>{@code --mode=camera|screen|none} runs an interactive console session until {@code q} or end
 * of input; {@code --mode=controller} hands stdin/stdout to the {@link CommandRelay}. Without the
 * argument, {@code relay.mode} applies.
 */
@Component
@ConditionalOnProperty(prefix = "relay.runner", name = "enabled", havingValue = "true", matchIfMissing = true)
public class LiveRelayRunner implements ApplicationRunner, ExitCodeGenerator {

    private static final Logger LOG = LogManager.getLogger(LiveRelayRunner.class);

    static final String MODE_OPTION = "mode";

    private final StreamPipelineFactory pipelineFactory;
    private final CommandRelay relay;
    private final String defaultMode;
    private volatile int exitCode;

    public LiveRelayRunner(StreamPipelineFactory pipelineFactory,
                           CommandRelay relay,
                           @Value("${relay.mode:camera}") String defaultMode) {
        this.pipelineFactory = pipelineFactory;
        this.relay = relay;
        this.defaultMode = defaultMode;
    }

    @Override
    public void run(ApplicationArguments args) throws Exception {
        RunMode mode = RunMode.parse(resolveMode(args));
        LOG.info("Starting in {} mode", mode);
        if (mode.isController()) {
            relay.run(System.in);
            return;
        }
        StreamPipeline pipeline = pipelineFactory.create(new ConsoleResponseSink(System.out));
        ConsoleTurnIntake intake = new ConsoleTurnIntake(
                new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)),
                System.out, pipelineFactory.blockingIo());
        try {
            pipeline.run(mode.videoMode().orElseThrow(), intake);
        } catch (IOException | SessionException e) {
            LOG.error("Live session could not be started: {}", e.getMessage());
            exitCode = 1;
        } finally {
            pipeline.stop();
        }
    }

    String resolveMode(ApplicationArguments args) {
        List<String> values = args.getOptionValues(MODE_OPTION);
        if (values != null && !values.isEmpty()) {
            return values.get(values.size() - 1);
        }
        return defaultMode;
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
