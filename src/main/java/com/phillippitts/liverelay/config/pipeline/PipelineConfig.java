package com.phillippitts.liverelay.config.pipeline;

import com.phillippitts.liverelay.config.properties.CaptureProperties;
import com.phillippitts.liverelay.config.properties.LiveSessionProperties;
import com.phillippitts.liverelay.config.properties.PipelineProperties;
import com.phillippitts.liverelay.service.audio.AudioOutputProvider;
import com.phillippitts.liverelay.service.audio.JavaSoundAudioOutputProvider;
import com.phillippitts.liverelay.service.capture.CameraFrameGrabber;
import com.phillippitts.liverelay.service.capture.CaptureSourceFactory;
import com.phillippitts.liverelay.service.capture.MicrophoneCaptureSource;
import com.phillippitts.liverelay.service.capture.ScreenFrameGrabber;
import com.phillippitts.liverelay.service.channel.BlockingIo;
import com.phillippitts.liverelay.service.pipeline.StreamPipelineFactory;
import com.phillippitts.liverelay.service.relay.CommandRelay;
import com.phillippitts.liverelay.service.relay.ControllerEventWriter;
import com.phillippitts.liverelay.service.session.LiveSessionFactory;
import com.phillippitts.liverelay.service.session.gemini.GeminiLiveSessionFactory;
import com.phillippitts.liverelay.service.tools.ToolHostRegistry;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Wires devices, the live session adapter and the streaming pipeline.
 */
@Configuration
public class PipelineConfig {

    /**
     * Blocking device calls (grabs, line reads/writes, console reads) run on the device pool.
     */
    @Bean
    public BlockingIo blockingIo(@Qualifier("deviceExecutor") ThreadPoolTaskExecutor deviceExecutor) {
        return new BlockingIo(deviceExecutor);
    }

    @Bean
    public CaptureSourceFactory captureSourceFactory(CaptureProperties captureProperties,
                                                     BlockingIo blockingIo,
                                                     ApplicationEventPublisher publisher) {
        int cameraIndex = captureProperties.getCameraIndex();
        return new CaptureSourceFactory(captureProperties, blockingIo, publisher,
                MicrophoneCaptureSource.defaultProvider(),
                () -> new CameraFrameGrabber(cameraIndex),
                ScreenFrameGrabber::new);
    }

    @Bean
    public AudioOutputProvider audioOutputProvider() {
        return new JavaSoundAudioOutputProvider();
    }

    @Bean
    public LiveSessionFactory liveSessionFactory(LiveSessionProperties sessionProperties) {
        return new GeminiLiveSessionFactory(sessionProperties);
    }

    @Bean
    public StreamPipelineFactory streamPipelineFactory(LiveSessionFactory liveSessionFactory,
                                                       CaptureSourceFactory captureSourceFactory,
                                                       AudioOutputProvider audioOutputProvider,
                                                       @Qualifier("pipelineExecutor") ThreadPoolTaskExecutor pipelineExecutor,
                                                       BlockingIo blockingIo,
                                                       ApplicationEventPublisher publisher,
                                                       PipelineProperties pipelineProperties) {
        return new StreamPipelineFactory(liveSessionFactory, captureSourceFactory, audioOutputProvider,
                pipelineExecutor, blockingIo, publisher, pipelineProperties);
    }

    /**
     * Controller relay. Events go to stdout; all logging goes to stderr.
     */
    @Bean
    public CommandRelay commandRelay(StreamPipelineFactory streamPipelineFactory,
                                     ToolHostRegistry toolHostRegistry,
                                     PipelineProperties pipelineProperties) {
        return new CommandRelay(streamPipelineFactory, toolHostRegistry,
                new ControllerEventWriter(System.out), pipelineProperties);
    }
}
