/**
 * Boundary to the realtime AI service.
 *
 * <p>The pipeline depends only on {@link com.phillippitts.liverelay.service.session.LiveSession}
 * and {@link com.phillippitts.liverelay.service.session.LiveSessionFactory}; the production
 * adapter lives in {@code service.session.gemini}.
 */
package com.phillippitts.liverelay.service.session;
