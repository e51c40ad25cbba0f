package com.phillippitts.liverelay.service.pipeline;

import com.phillippitts.liverelay.config.ThreadPoolConfig;
import com.phillippitts.liverelay.config.properties.CaptureProperties;
import com.phillippitts.liverelay.config.properties.ThreadPoolProperties;
import com.phillippitts.liverelay.domain.MediaFrame;
import com.phillippitts.liverelay.domain.VideoMode;
import com.phillippitts.liverelay.service.capture.CaptureErrorEvent;
import com.phillippitts.liverelay.service.capture.CaptureSourceFactory;
import com.phillippitts.liverelay.service.channel.BlockingIo;
import com.phillippitts.liverelay.service.session.ResponseFragment;
import com.phillippitts.liverelay.testutil.EventCapturingPublisher;
import com.phillippitts.liverelay.testutil.FakeFrameGrabber;
import com.phillippitts.liverelay.testutil.FakeLiveSession;
import com.phillippitts.liverelay.testutil.FakeLiveSessionFactory;
import com.phillippitts.liverelay.testutil.FakeTargetDataLine;
import com.phillippitts.liverelay.testutil.RecordingAudioOutputProvider;
import com.phillippitts.liverelay.testutil.RecordingResponseSink;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import javax.sound.sampled.LineUnavailableException;
import java.io.IOException;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

class StreamPipelineTest {

    private ThreadPoolTaskExecutor executor;
    private ExecutorService devicePool;
    private BlockingIo io;
    private final EventCapturingPublisher publisher = new EventCapturingPublisher();
    private final FakeLiveSessionFactory sessions = new FakeLiveSessionFactory();
    private final RecordingResponseSink sink = new RecordingResponseSink();
    private final List<FakeTargetDataLine> lines = new CopyOnWriteArrayList<>();
    private final FakeFrameGrabber camera = new FakeFrameGrabber("camera", -1, 64, 48);
    private final FakeFrameGrabber screen = new FakeFrameGrabber("screen", -1, 64, 48);
    private RecordingAudioOutputProvider speaker;
    private boolean micUnavailable;
    private StreamPipeline pipeline;

    @BeforeEach
    void setUp() {
        executor = new ThreadPoolConfig(new ThreadPoolProperties()).pipelineExecutor();
        devicePool = Executors.newCachedThreadPool();
        io = new BlockingIo(devicePool);
        speaker = new RecordingAudioOutputProvider();
    }

    @AfterEach
    void tearDown() {
        if (pipeline != null) {
            pipeline.stop();
        }
        executor.shutdown();
        devicePool.shutdownNow();
    }

    private StreamPipeline newPipeline() {
        CaptureProperties capture = new CaptureProperties(10L, 32, 32, 0.75f, 0, 256, null);
        CaptureSourceFactory sources = new CaptureSourceFactory(capture, io, publisher,
                (fmt, dev) -> {
                    if (micUnavailable) {
                        throw new LineUnavailableException("no microphone");
                    }
                    FakeTargetDataLine line = new FakeTargetDataLine(fmt, -1, 5);
                    line.open(fmt);
                    lines.add(line);
                    return line;
                },
                () -> camera,
                () -> screen);
        pipeline = StreamPipeline.builder()
                .sessionFactory(sessions)
                .captureSources(sources)
                .audioOutputs(speaker)
                .executor(executor)
                .blockingIo(io)
                .publisher(publisher)
                .sink(sink)
                .outboundCapacity(5)
                .stopTimeoutMs(2000)
                .build();
        return pipeline;
    }

    @Test
    void startWithCameraStreamsAudioAndFramesThenStopsCleanly() throws Exception {
        // Arrange
        StreamPipeline p = newPipeline();

        // Act
        p.start(VideoMode.CAMERA, new QueuedTurnIntake());
        FakeLiveSession session = sessions.last();
        await().atMost(5, TimeUnit.SECONDS).until(() ->
                !session.sentAudio().isEmpty() && !session.sentMedia().isEmpty());
        p.stop();

        // Assert
        assertThat(p.state()).isEqualTo(PipelineState.IDLE);
        assertThat(p.isRunning()).isFalse();
        assertThat(session.isClosed()).isTrue();
        assertThat(camera.wasClosed()).isTrue();
        assertThat(lines).singleElement().satisfies(line -> assertThat(line.wasClosed()).isTrue());
        assertThat(speaker.closeCount()).isEqualTo(speaker.openCount());
        assertThat(sink.frames()).contains("camera");
        assertThat(session.sentMedia().get(0).mimeType()).isEqualTo(MediaFrame.JPEG);
        assertThat(session.sentAudio().get(0).sampleRate()).isEqualTo(16_000);
        assertThat(screen.grabs()).isZero();
    }

    @Test
    void noneModeRunsWithoutImageSource() throws Exception {
        StreamPipeline p = newPipeline();

        p.start(VideoMode.NONE, new QueuedTurnIntake());
        FakeLiveSession session = sessions.last();
        await().atMost(5, TimeUnit.SECONDS).until(() -> !session.sentAudio().isEmpty());
        p.stop();

        assertThat(session.sentMedia()).isEmpty();
        assertThat(camera.grabs()).isZero();
        assertThat(screen.grabs()).isZero();
    }

    @Test
    void stopIsIdempotent() throws Exception {
        StreamPipeline p = newPipeline();
        p.start(VideoMode.NONE, new QueuedTurnIntake());

        p.stop();
        p.stop();

        assertThat(p.state()).isEqualTo(PipelineState.IDLE);
    }

    @Test
    void concurrentStopCallersAllReturnAfterTeardown() throws Exception {
        StreamPipeline p = newPipeline();
        p.start(VideoMode.SCREEN, new QueuedTurnIntake());
        FakeLiveSession session = sessions.last();

        CompletableFuture<Void> a = CompletableFuture.runAsync(p::stop);
        CompletableFuture<Void> b = CompletableFuture.runAsync(p::stop);
        CompletableFuture.allOf(a, b).get(10, TimeUnit.SECONDS);

        assertThat(p.state()).isEqualTo(PipelineState.IDLE);
        assertThat(session.isClosed()).isTrue();
    }

    @Test
    void textTurnsReachSessionAndResponsesReachSinkAndSpeaker() throws Exception {
        // Arrange
        StreamPipeline p = newPipeline();
        QueuedTurnIntake intake = new QueuedTurnIntake();
        p.start(VideoMode.NONE, intake);
        FakeLiveSession session = sessions.last();

        // Act
        intake.submit("hello");
        await().atMost(5, TimeUnit.SECONDS).until(() -> session.sentText().contains("hello"));
        FakeLiveSession.ScriptedTurn turn = session.openTurn();
        turn.emit(ResponseFragment.audio(new byte[] {1, 2, 3, 4}));
        await().atMost(5, TimeUnit.SECONDS).until(() -> speaker.written().size() == 1);
        turn.emit(ResponseFragment.text("Hi there"));
        turn.complete();

        // Assert
        await().atMost(5, TimeUnit.SECONDS).until(() -> sink.turnsCompleted() == 1);
        assertThat(sink.audio()).hasSize(1);
        assertThat(sink.text()).containsExactly("Hi there");
        assertThat(speaker.written().get(0)).containsExactly(1, 2, 3, 4);
    }

    @Test
    void interruptDiscardsQueuedPlaybackWithoutStoppingReceiver() throws Exception {
        // Arrange: the speaker accepts nothing until released
        speaker = new RecordingAudioOutputProvider().gated();
        StreamPipeline p = newPipeline();
        p.start(VideoMode.NONE, new QueuedTurnIntake());
        FakeLiveSession session = sessions.last();
        FakeLiveSession.ScriptedTurn turn = session.openTurn();
        for (int i = 0; i < 4; i++) {
            turn.emit(ResponseFragment.audio(new byte[] {(byte) i, 0}));
        }
        await().atMost(5, TimeUnit.SECONDS).until(() -> sink.audio().size() == 4);

        // Act
        int discarded = p.interrupt();

        // Assert: at most one fragment was already taken by the blocked player
        assertThat(discarded).isBetween(3, 4);
        assertThat(p.isRunning()).isTrue();
        speaker.release(10);
        turn.emit(ResponseFragment.text("still here"));
        turn.complete();
        await().atMost(5, TimeUnit.SECONDS).until(() -> sink.turnsCompleted() == 1);
        assertThat(sink.text()).containsExactly("still here");
        assertThat(speaker.written().size()).isLessThanOrEqualTo(1);
    }

    @Test
    void audioArrivingAfterInterruptIsStillPlayed() throws Exception {
        // Arrange
        speaker = new RecordingAudioOutputProvider().gated();
        StreamPipeline p = newPipeline();
        p.start(VideoMode.NONE, new QueuedTurnIntake());
        FakeLiveSession.ScriptedTurn turn = sessions.last().openTurn();
        for (int i = 0; i < 4; i++) {
            turn.emit(ResponseFragment.audio(new byte[] {(byte) i, 0}));
        }
        await().atMost(5, TimeUnit.SECONDS).until(() -> sink.audio().size() == 4);
        p.interrupt();

        // Act
        turn.emit(ResponseFragment.audio(new byte[] {42, 42}));
        await().atMost(5, TimeUnit.SECONDS).until(() -> sink.audio().size() == 5);
        speaker.release(10);

        // Assert: the fresh fragment plays; of the stale ones only the one already in the player may
        await().atMost(5, TimeUnit.SECONDS).until(() -> speaker.written().stream()
                .anyMatch(pcm -> pcm[0] == 42));
        assertThat(speaker.written()).last().satisfies(pcm -> assertThat(pcm).containsExactly(42, 42));
        assertThat(speaker.written()).extracting(pcm -> pcm[0])
                .doesNotContain((byte) 1, (byte) 2, (byte) 3);
        assertThat(p.isRunning()).isTrue();
    }

    @Test
    void turnEndDiscardsStaleAudio() throws Exception {
        speaker = new RecordingAudioOutputProvider().gated();
        StreamPipeline p = newPipeline();
        p.start(VideoMode.NONE, new QueuedTurnIntake());
        FakeLiveSession session = sessions.last();

        session.respond(ResponseFragment.audio(new byte[] {1, 1}),
                ResponseFragment.audio(new byte[] {2, 2}),
                ResponseFragment.audio(new byte[] {3, 3}));
        await().atMost(5, TimeUnit.SECONDS).until(() -> sink.turnsCompleted() == 1);
        speaker.release(10);

        assertThat(p.interrupt()).isZero();
        Thread.sleep(100);
        assertThat(speaker.written().size()).isLessThanOrEqualTo(1);
    }

    @Test
    void intakeEndStopsThePipeline() throws Exception {
        StreamPipeline p = newPipeline();
        QueuedTurnIntake intake = new QueuedTurnIntake();
        p.start(VideoMode.NONE, intake);
        FakeLiveSession session = sessions.last();

        intake.close();

        await().atMost(5, TimeUnit.SECONDS).until(() -> p.state() == PipelineState.IDLE);
        assertThat(session.isClosed()).isTrue();
    }

    @Test
    void runReturnsOnceIntakeEnds() throws Exception {
        StreamPipeline p = newPipeline();
        QueuedTurnIntake intake = new QueuedTurnIntake();
        intake.submit("only turn");
        CompletableFuture<Void> running = CompletableFuture.runAsync(() -> {
            try {
                p.run(VideoMode.NONE, intake);
            } catch (IOException | InterruptedException e) {
                throw new IllegalStateException(e);
            }
        });
        await().atMost(5, TimeUnit.SECONDS).until(() -> !sessions.sessions().isEmpty()
                && sessions.last().sentText().contains("only turn"));

        intake.close();

        running.get(10, TimeUnit.SECONDS);
        assertThat(p.state()).isEqualTo(PipelineState.IDLE);
    }

    @Test
    void sessionFailureStopsThePipeline() throws Exception {
        StreamPipeline p = newPipeline();
        p.start(VideoMode.NONE, new QueuedTurnIntake());
        FakeLiveSession session = sessions.last();

        session.failConnection();

        await().atMost(5, TimeUnit.SECONDS).until(() -> p.state() == PipelineState.IDLE);
        assertThat(session.isClosed()).isTrue();
    }

    @Test
    void connectFailureLeavesPipelineIdle() {
        sessions.failWith(new IOException("connection refused"));
        StreamPipeline p = newPipeline();

        assertThatThrownBy(() -> p.start(VideoMode.CAMERA, new QueuedTurnIntake()))
                .isInstanceOf(IOException.class)
                .hasMessage("connection refused");
        assertThat(p.state()).isEqualTo(PipelineState.IDLE);
        assertThat(camera.grabs()).isZero();
    }

    @Test
    void secondStartIsRejectedWhileRunning() throws Exception {
        StreamPipeline p = newPipeline();
        p.start(VideoMode.NONE, new QueuedTurnIntake());

        assertThatThrownBy(() -> p.start(VideoMode.NONE, new QueuedTurnIntake()))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("already active");
        assertThat(sessions.sessions()).hasSize(1);
    }

    @Test
    void canRestartAfterStop() throws Exception {
        StreamPipeline p = newPipeline();
        p.start(VideoMode.NONE, new QueuedTurnIntake());
        p.stop();

        p.start(VideoMode.NONE, new QueuedTurnIntake());

        assertThat(p.isRunning()).isTrue();
        assertThat(sessions.sessions()).hasSize(2);
        assertThat(sessions.sessions().get(0).isClosed()).isTrue();
    }

    @Test
    void enqueueRequiresRunningPipeline() throws Exception {
        StreamPipeline p = newPipeline();

        assertThatThrownBy(() -> p.enqueue(MediaFrame.jpeg(new byte[] {1})))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("Pipeline not running");

        p.start(VideoMode.NONE, new QueuedTurnIntake());
        p.enqueue(MediaFrame.jpeg(new byte[] {7}));
        FakeLiveSession session = sessions.last();
        await().atMost(5, TimeUnit.SECONDS).until(() -> !session.sentMedia().isEmpty());
        assertThat(session.sentMedia().get(0).payload()).containsExactly(7);
    }

    @Test
    void deviceFailuresDoNotStopThePipeline() throws Exception {
        // Arrange: no microphone, no speaker
        micUnavailable = true;
        speaker = new RecordingAudioOutputProvider().unavailable();
        StreamPipeline p = newPipeline();
        QueuedTurnIntake intake = new QueuedTurnIntake();

        // Act
        p.start(VideoMode.NONE, intake);
        FakeLiveSession session = sessions.last();
        await().atMost(5, TimeUnit.SECONDS).until(() ->
                publisher.eventsOfType(CaptureErrorEvent.class).size() == 2);
        intake.submit("are you there?");
        session.respond(ResponseFragment.audio(new byte[] {1, 2}), ResponseFragment.text("yes"));

        // Assert
        await().atMost(5, TimeUnit.SECONDS).until(() -> sink.turnsCompleted() == 1);
        assertThat(p.isRunning()).isTrue();
        assertThat(publisher.eventsOfType(CaptureErrorEvent.class))
                .extracting(CaptureErrorEvent::reason)
                .containsExactlyInAnyOrder("MIC_UNAVAILABLE", "SPEAKER_UNAVAILABLE");
        assertThat(sink.text()).containsExactly("yes");
    }

    @Test
    void interruptWhenIdleReturnsZero() {
        assertThat(newPipeline().interrupt()).isZero();
    }
}
