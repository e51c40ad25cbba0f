/**
 * Immutable domain values exchanged between the capture sources, the pipeline and the session.
 *
 * <ul>
 *   <li>{@link com.phillippitts.liverelay.domain.OutboundItem} - closed union of
 *       {@link com.phillippitts.liverelay.domain.AudioChunk} and
 *       {@link com.phillippitts.liverelay.domain.MediaFrame}, the unit of the bounded queue</li>
 *   <li>{@link com.phillippitts.liverelay.domain.InboundEvent} - audio, text and turn-complete
 *       events produced by the receive loop</li>
 *   <li>{@link com.phillippitts.liverelay.domain.VideoMode} - camera, screen or none</li>
 * </ul>
 *
 * <p>Byte payloads are copied in and out, so a value handed to the queue cannot be mutated
 * by its producer afterwards.
 *
 * @since 1.0
 */
package com.phillippitts.liverelay.domain;
