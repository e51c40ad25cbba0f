package com.phillippitts.liverelay.service.pipeline;

import com.phillippitts.liverelay.domain.OutboundItem;
import com.phillippitts.liverelay.domain.VideoMode;
import com.phillippitts.liverelay.service.audio.AudioOutput;
import com.phillippitts.liverelay.service.audio.AudioOutputProvider;
import com.phillippitts.liverelay.service.capture.CaptureErrorEvent;
import com.phillippitts.liverelay.service.capture.CaptureSource;
import com.phillippitts.liverelay.service.capture.CaptureSourceFactory;
import com.phillippitts.liverelay.service.channel.BlockingIo;
import com.phillippitts.liverelay.service.channel.BoundedChannel;
import com.phillippitts.liverelay.service.channel.ChannelClosedException;
import com.phillippitts.liverelay.service.session.LiveSession;
import com.phillippitts.liverelay.service.session.LiveSessionFactory;
import com.phillippitts.liverelay.service.session.ResponseFragment;
import com.phillippitts.liverelay.service.session.ResponseTurn;
import com.phillippitts.liverelay.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.core.task.AsyncTaskExecutor;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.RejectedExecutionException;

/**
 * Concurrent bridge between local devices and one realtime AI session.
 *
 * <p>A run consists of one task per active role:
 * <ul>
 *   <li>intake: user text turns to the session (primary; its end stops the run)</li>
 *   <li>microphone and at most one camera/screen source: capture into the bounded outbound queue</li>
 *   <li>sender: outbound queue to the session</li>
 *   <li>receiver: model turns to the playback queue and the {@link ResponseSink}</li>
 *   <li>player: playback queue to the speaker</li>
 * </ul>
 *
 * <p>Tasks run on the pipeline executor and are cancelled by interruption. A task failing with an
 * unexpected error stops the whole run; a capture source ending (end of stream or device error)
 * does not.
 *
 * <p><b>Thread Safety:</b> {@link #start}, {@link #stop()}, {@link #interrupt()} and
 * {@link #enqueue} may be called from any thread. Concurrent {@link #stop()} callers all return
 * after the same teardown.
 *
 * @since 1.0
 */
public final class StreamPipeline {

    private static final Logger LOG = LogManager.getLogger(StreamPipeline.class);

    static final String MDC_TASK = "pipelineTask";

    private final LiveSessionFactory sessionFactory;
    private final CaptureSourceFactory captureSources;
    private final AudioOutputProvider audioOutputs;
    private final SessionTranscoder transcoder;
    private final AsyncTaskExecutor executor;
    private final BlockingIo io;
    private final ApplicationEventPublisher publisher;
    private final ResponseSink sink;
    private final int outboundCapacity;
    private final long stopTimeoutMs;

    private final PipelineStateMachine stateMachine = new PipelineStateMachine();
    private volatile Run current;

    StreamPipeline(StreamPipelineBuilder b) {
        this.sessionFactory = b.sessionFactory;
        this.captureSources = b.captureSources;
        this.audioOutputs = b.audioOutputs;
        this.transcoder = b.transcoder;
        this.executor = b.executor;
        this.io = b.io;
        this.publisher = b.publisher;
        this.sink = b.sink;
        this.outboundCapacity = b.outboundCapacity;
        this.stopTimeoutMs = b.stopTimeoutMs;
    }

    public static StreamPipelineBuilder builder() {
        return new StreamPipelineBuilder();
    }

    /**
     * Connects a session and launches all tasks.
     *
     * @throws IllegalStateException if the pipeline is not idle
     * @throws IOException if the session cannot be connected; the pipeline stays idle
     */
    public void start(VideoMode mode, TurnIntake intake) throws IOException, InterruptedException {
        Objects.requireNonNull(mode, "mode");
        Objects.requireNonNull(intake, "intake");
        if (!stateMachine.beginStart()) {
            throw new IllegalStateException("Pipeline already active: " + stateMachine.current());
        }
        LOG.info("Starting pipeline: mode={}", mode.wireName());
        Run run = null;
        try {
            LiveSession session = sessionFactory.connect();
            run = new Run(session, intake, outboundCapacity);
            launchAll(run, mode);
            current = run;
            stateMachine.markRunning();
        } catch (IOException | InterruptedException | RuntimeException e) {
            LOG.warn("Pipeline start failed: {}", e.toString());
            if (run != null) {
                teardown(run);
            }
            stateMachine.abortStart();
            throw e;
        }
        startSupervisor(run);
        LOG.info("Pipeline running: mode={}, tasks={}", mode.wireName(), run.tasks.size());
    }

    /**
     * Starts and waits until the run has been torn down (intake ended, failure or {@link #stop()}).
     */
    public void run(VideoMode mode, TurnIntake intake) throws IOException, InterruptedException {
        start(mode, intake);
        awaitStopped();
    }

    /**
     * Waits until the current run, if any, has been torn down.
     */
    public void awaitStopped() throws InterruptedException {
        Run run = current;
        if (run == null) {
            return;
        }
        try {
            run.stopped.get();
        } catch (ExecutionException e) {
            throw new IllegalStateException("Teardown failed", e.getCause());
        }
    }

    /**
     * Cancels every task, closes channels and the session, and waits for all tasks to finish.
     * Idempotent.
     */
    public void stop() {
        try {
            stateMachine.awaitSettled();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Interrupted while waiting for pipeline start to settle");
            return;
        }
        Run run = current;
        if (run == null) {
            return;
        }
        if (stateMachine.beginStop()) {
            LOG.info("Stopping pipeline");
            try {
                teardown(run);
            } finally {
                current = null;
                stateMachine.markIdle();
                run.stopped.complete(null);
                LOG.info("Pipeline stopped");
            }
        } else {
            run.stopped.join();
        }
    }

    /**
     * Discards all audio waiting for playback. The receiver keeps running.
     *
     * @return number of discarded fragments
     */
    public int interrupt() {
        Run run = current;
        return run == null ? 0 : run.playback.drain();
    }

    /**
     * Queues an item (e.g. an image from the controller) for the session.
     *
     * @throws IllegalStateException if the pipeline is not running
     */
    public void enqueue(OutboundItem item) throws InterruptedException {
        Run run = current;
        if (run == null || stateMachine.current() != PipelineState.RUNNING) {
            throw new IllegalStateException("Pipeline not running");
        }
        run.outbound.put(item);
    }

    public boolean isRunning() {
        return stateMachine.current() == PipelineState.RUNNING;
    }

    public PipelineState state() {
        return stateMachine.current();
    }

    private void launchAll(Run run, VideoMode mode) {
        launch(run, TaskRole.INTAKE, () -> intake(run));
        launch(run, TaskRole.SENDER, () -> send(run));
        CaptureSource microphone = captureSources.microphone();
        launch(run, TaskRole.MICROPHONE, () -> capture(run, microphone));
        Optional<CaptureSource> images = captureSources.imageSource(mode, sink::onFrameCaptured);
        images.ifPresent(source -> launch(run, TaskRole.CAPTURE, () -> capture(run, source)));
        launch(run, TaskRole.RECEIVER, () -> receive(run));
        launch(run, TaskRole.PLAYER, () -> play(run));
    }

    @FunctionalInterface
    private interface TaskBody {
        void run() throws Exception;
    }

    private void launch(Run run, TaskRole role, TaskBody body) {
        TaskHandle handle = new TaskHandle(role);
        run.tasks.add(handle);
        Runnable wrapper = () -> {
            if (!handle.claim()) {
                return;
            }
            ThreadContext.put(MDC_TASK, role.label());
            try {
                body.run();
                onTaskCompleted(run, role);
            } catch (InterruptedException | ChannelClosedException e) {
                LOG.debug("{} task cancelled", role.label());
            } catch (Throwable t) {
                if (run.stopping) {
                    LOG.debug("{} task ended during stop: {}", role.label(), t.toString());
                } else {
                    LOG.error("{} task failed; stopping pipeline", role.label(), t);
                    run.termination.complete(null);
                }
            } finally {
                ThreadContext.remove(MDC_TASK);
                handle.markDone();
            }
        };
        try {
            handle.attach(executor.submit(wrapper));
        } catch (RejectedExecutionException e) {
            throw new IllegalStateException("No worker available for " + role.label() + " task", e);
        }
    }

    private void onTaskCompleted(Run run, TaskRole role) {
        if (role == TaskRole.INTAKE) {
            LOG.info("Intake ended; stopping pipeline");
            run.termination.complete(null);
        } else {
            LOG.debug("{} task ended", role.label());
        }
    }

    private void intake(Run run) throws IOException, InterruptedException {
        while (true) {
            Optional<String> turn = run.intake.nextTurn();
            if (turn.isEmpty()) {
                return;
            }
            LOG.debug("Sending turn: '{}'", LogSanitizer.truncate(turn.get(), 60));
            run.session.sendText(turn.get(), true);
        }
    }

    private void send(Run run) throws IOException, InterruptedException {
        while (true) {
            Optional<OutboundItem> item = run.outbound.get();
            if (item.isEmpty()) {
                return;
            }
            transcoder.forward(item.get(), run.session);
        }
    }

    private void capture(Run run, CaptureSource source) throws InterruptedException {
        source.run(run.outbound);
        LOG.info("{} source ended", source.name());
    }

    private void receive(Run run) throws IOException, InterruptedException {
        while (true) {
            ResponseTurn turn = run.session.receive();
            Optional<ResponseFragment> fragment;
            while ((fragment = turn.next()).isPresent()) {
                ResponseFragment f = fragment.get();
                if (f.hasData()) {
                    run.playback.put(f.data());
                    sink.onAudio(f.data());
                }
                if (f.hasText()) {
                    sink.onText(f.text());
                }
            }
            // Audio still queued at the end of a turn is stale
            int discarded = run.playback.drain();
            if (discarded > 0) {
                LOG.debug("Turn complete; discarded {} queued audio fragments", discarded);
            }
            sink.onTurnComplete();
        }
    }

    private void play(Run run) throws InterruptedException {
        AudioOutput output;
        try {
            output = io.call(audioOutputs::open);
        } catch (IOException e) {
            LOG.warn("Speaker unavailable, model audio will not be played: {}", e.getMessage());
            publisher.publishEvent(CaptureErrorEvent.now("SPEAKER_UNAVAILABLE", "speaker"));
            long discarded = 0;
            while (run.playback.get().isPresent()) {
                discarded++;
            }
            LOG.debug("Playback queue closed; {} fragments discarded without a speaker", discarded);
            return;
        }
        try {
            Optional<byte[]> pcm;
            while ((pcm = run.playback.get()).isPresent()) {
                byte[] data = pcm.get();
                io.call(() -> {
                    output.write(data);
                    return null;
                });
            }
        } catch (IOException e) {
            LOG.warn("Speaker write failed, playback stopped: {}", e.getMessage());
            publisher.publishEvent(CaptureErrorEvent.now("SPEAKER_ERROR", "speaker"));
        } finally {
            output.close();
        }
    }

    private void startSupervisor(Run run) {
        Thread supervisor = new Thread(() -> {
            run.termination.join();
            if (current == run) {
                stop();
            }
        }, "pipeline-supervisor");
        supervisor.setDaemon(true);
        supervisor.start();
    }

    private void teardown(Run run) {
        run.stopping = true;
        for (TaskHandle handle : run.tasks) {
            handle.cancel();
        }
        run.outbound.close();
        run.playback.close();
        run.intake.close();
        try {
            for (TaskHandle handle : run.tasks) {
                if (!handle.awaitDone(stopTimeoutMs)) {
                    LOG.warn("{} task did not finish within {}ms", handle.role().label(), stopTimeoutMs);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Interrupted while waiting for pipeline tasks");
        } finally {
            run.session.close();
            run.termination.complete(null);
        }
    }

    /** State of one start/stop cycle. */
    private static final class Run {
        final LiveSession session;
        final TurnIntake intake;
        final BoundedChannel<OutboundItem> outbound;
        final BoundedChannel<byte[]> playback = BoundedChannel.unbounded("playback");
        final List<TaskHandle> tasks = new ArrayList<>();
        final CompletableFuture<Void> termination = new CompletableFuture<>();
        final CompletableFuture<Void> stopped = new CompletableFuture<>();
        volatile boolean stopping;

        Run(LiveSession session, TurnIntake intake, int outboundCapacity) {
            this.session = session;
            this.intake = intake;
            this.outbound = new BoundedChannel<>("outbound", outboundCapacity);
        }
    }
}
