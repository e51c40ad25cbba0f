package com.phillippitts.liverelay.service.pipeline;

import com.phillippitts.liverelay.config.properties.PipelineProperties;
import com.phillippitts.liverelay.service.audio.AudioOutputProvider;
import com.phillippitts.liverelay.service.capture.CaptureSourceFactory;
import com.phillippitts.liverelay.service.channel.BlockingIo;
import com.phillippitts.liverelay.service.session.LiveSessionFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.core.task.AsyncTaskExecutor;

import java.util.Objects;

/**
 * Creates pipelines bound to a response sink, sharing the application's session factory,
 * devices and executors.
 */
public class StreamPipelineFactory {

    private final LiveSessionFactory sessionFactory;
    private final CaptureSourceFactory captureSources;
    private final AudioOutputProvider audioOutputs;
    private final AsyncTaskExecutor executor;
    private final BlockingIo io;
    private final ApplicationEventPublisher publisher;
    private final PipelineProperties props;

    public StreamPipelineFactory(LiveSessionFactory sessionFactory,
                                 CaptureSourceFactory captureSources,
                                 AudioOutputProvider audioOutputs,
                                 AsyncTaskExecutor executor,
                                 BlockingIo io,
                                 ApplicationEventPublisher publisher,
                                 PipelineProperties props) {
        this.sessionFactory = Objects.requireNonNull(sessionFactory);
        this.captureSources = Objects.requireNonNull(captureSources);
        this.audioOutputs = Objects.requireNonNull(audioOutputs);
        this.executor = Objects.requireNonNull(executor);
        this.io = Objects.requireNonNull(io);
        this.publisher = Objects.requireNonNull(publisher);
        this.props = Objects.requireNonNull(props);
    }

    public StreamPipeline create(ResponseSink sink) {
        return StreamPipeline.builder()
                .sessionFactory(sessionFactory)
                .captureSources(captureSources)
                .audioOutputs(audioOutputs)
                .executor(executor)
                .blockingIo(io)
                .publisher(publisher)
                .sink(sink)
                .outboundCapacity(props.getOutboundCapacity())
                .stopTimeoutMs(props.getStopTimeoutMs())
                .build();
    }

    public BlockingIo blockingIo() {
        return io;
    }
}
