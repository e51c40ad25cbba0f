package com.phillippitts.liverelay.service.session;

import java.io.IOException;
import java.util.Optional;

/**
 * One model turn, read fragment by fragment.
 */
@FunctionalInterface
public interface ResponseTurn {

    /**
     * Waits for the next fragment of this turn.
     *
     * @return the fragment, or empty once the turn is complete
     */
    Optional<ResponseFragment> next() throws IOException, InterruptedException;
}
