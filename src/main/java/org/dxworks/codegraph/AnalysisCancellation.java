package org.dxworks.codegraph;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * External cancellation signal for a project scan. Once cancelled, no further files are
 * dispatched; analyses already running finish and their results are kept.
 */
public final class AnalysisCancellation {

    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    public static AnalysisCancellation none() {
        return new AnalysisCancellation();
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
