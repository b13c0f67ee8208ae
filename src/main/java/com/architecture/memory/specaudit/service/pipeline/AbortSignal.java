package com.architecture.memory.specaudit.service.pipeline;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Stops all further external calls of one pipeline run once raised. Completed analysis is kept.
 */
public class AbortSignal {

    private final AtomicReference<String> reason = new AtomicReference<>();

    public void abort(String why) {
        reason.compareAndSet(null, why == null ? "aborted" : why);
    }

    public boolean isAborted() {
        return reason.get() != null;
    }

    public String getReason() {
        return reason.get();
    }
}
