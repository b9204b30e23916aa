package com.uchion.infrastructure.ai.pipeline;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Lets a caller abandon a running validation. Cancelling cancels every registered in-flight
 * oracle call and interrupts its thread; the pipeline checks the flag between stages and
 * drops results that arrive later.
 */
public class CancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final List<Future<?>> inFlight = new CopyOnWriteArrayList<>();

    public static CancellationToken none() {
        return new CancellationToken();
    }

    public void register(Future<?> future) {
        inFlight.add(future);
        if (cancelled.get()) {
            future.cancel(true);
        }
    }

    public void cancel() {
        if (cancelled.compareAndSet(false, true)) {
            inFlight.forEach(f -> f.cancel(true));
        }
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
