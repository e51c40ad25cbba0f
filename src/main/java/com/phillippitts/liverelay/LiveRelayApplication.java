package com.phillippitts.liverelay;

import com.phillippitts.liverelay.config.properties.CaptureProperties;
import com.phillippitts.liverelay.config.properties.LiveSessionProperties;
import com.phillippitts.liverelay.config.properties.PipelineProperties;
import com.phillippitts.liverelay.config.properties.ToolHostProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableConfigurationProperties({
        PipelineProperties.class,
        CaptureProperties.class,
        LiveSessionProperties.class,
        ToolHostProperties.class
})
@EnableScheduling
public class LiveRelayApplication {

    public static void main(String[] args) {
        SpringApplication app = new SpringApplication(LiveRelayApplication.class);
        // Screen capture needs a display
        app.setHeadless(false);
        System.exit(SpringApplication.exit(app.run(args)));
    }

}
