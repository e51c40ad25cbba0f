package com.phillippitts.liverelay.service.pipeline;

import com.phillippitts.liverelay.service.audio.AudioOutputProvider;
import com.phillippitts.liverelay.service.capture.CaptureSourceFactory;
import com.phillippitts.liverelay.service.channel.BlockingIo;
import com.phillippitts.liverelay.service.session.LiveSessionFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.core.task.AsyncTaskExecutor;

import java.util.Objects;

/**
 * Builder for {@link StreamPipeline}.
 *
 * <p><b>Usage Example:</b>
 * <pre>{@code
 * StreamPipeline pipeline = StreamPipeline.builder()
 *     .sessionFactory(sessionFactory)
 *     .captureSources(captureSourceFactory)
 *     .audioOutputs(new JavaSoundAudioOutputProvider())
 *     .executor(pipelineExecutor)
 *     .blockingIo(new BlockingIo(deviceExecutor))
 *     .publisher(publisher)
 *     .sink(new ConsoleResponseSink(System.out))
 *     .build();
 * }</pre>
 *
 * @since 1.0
 */
public final class StreamPipelineBuilder {

    LiveSessionFactory sessionFactory;
    CaptureSourceFactory captureSources;
    AudioOutputProvider audioOutputs;
    SessionTranscoder transcoder = new SessionTranscoder();
    AsyncTaskExecutor executor;
    BlockingIo io;
    ApplicationEventPublisher publisher;
    ResponseSink sink;
    int outboundCapacity = 5;
    long stopTimeoutMs = 5000L;

    StreamPipelineBuilder() {
    }

    public StreamPipelineBuilder sessionFactory(LiveSessionFactory sessionFactory) {
        this.sessionFactory = sessionFactory;
        return this;
    }

    public StreamPipelineBuilder captureSources(CaptureSourceFactory captureSources) {
        this.captureSources = captureSources;
        return this;
    }

    public StreamPipelineBuilder audioOutputs(AudioOutputProvider audioOutputs) {
        this.audioOutputs = audioOutputs;
        return this;
    }

    public StreamPipelineBuilder transcoder(SessionTranscoder transcoder) {
        this.transcoder = transcoder;
        return this;
    }

    public StreamPipelineBuilder executor(AsyncTaskExecutor executor) {
        this.executor = executor;
        return this;
    }

    public StreamPipelineBuilder blockingIo(BlockingIo io) {
        this.io = io;
        return this;
    }

    public StreamPipelineBuilder publisher(ApplicationEventPublisher publisher) {
        this.publisher = publisher;
        return this;
    }

    public StreamPipelineBuilder sink(ResponseSink sink) {
        this.sink = sink;
        return this;
    }

    public StreamPipelineBuilder outboundCapacity(int outboundCapacity) {
        this.outboundCapacity = outboundCapacity;
        return this;
    }

    public StreamPipelineBuilder stopTimeoutMs(long stopTimeoutMs) {
        this.stopTimeoutMs = stopTimeoutMs;
        return this;
    }

    /**
     * Builds the pipeline.
     *
     * @throws NullPointerException if a required dependency is missing
     * @throws IllegalArgumentException if a size or timeout is not positive
     */
    public StreamPipeline build() {
        Objects.requireNonNull(sessionFactory, "sessionFactory is required");
        Objects.requireNonNull(captureSources, "captureSources is required");
        Objects.requireNonNull(audioOutputs, "audioOutputs is required");
        Objects.requireNonNull(transcoder, "transcoder is required");
        Objects.requireNonNull(executor, "executor is required");
        Objects.requireNonNull(io, "blockingIo is required");
        Objects.requireNonNull(publisher, "publisher is required");
        Objects.requireNonNull(sink, "sink is required");
        if (outboundCapacity <= 0) {
            throw new IllegalArgumentException("outboundCapacity must be > 0");
        }
        if (stopTimeoutMs <= 0) {
            throw new IllegalArgumentException("stopTimeoutMs must be > 0");
        }
        return new StreamPipeline(this);
    }
}
