package com.phillippitts.liverelay.service.session;

import java.io.IOException;

/**
 * Connects new realtime sessions; one session per pipeline run.
 */
@FunctionalInterface
public interface LiveSessionFactory {

    LiveSession connect() throws IOException, InterruptedException;
}
