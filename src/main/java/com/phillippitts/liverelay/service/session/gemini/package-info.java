/**
 * Gemini Live adapter: JSON messages over a {@link java.net.http.WebSocket}, encoded and decoded
 * with org.json.
 */
package com.phillippitts.liverelay.service.session.gemini;
