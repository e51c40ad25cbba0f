package com.phillippitts.liverelay.service.tools;

import java.time.Instant;

/**
 * Request awaiting its response line.
 */
record PendingRequest(long id, String method, Instant issuedAt) {

    static PendingRequest issue(long id, String method) {
        return new PendingRequest(id, method, Instant.now());
    }
}
