/**
 * Local playback of the model's audio through Java Sound.
 */
package com.phillippitts.liverelay.service.audio;
