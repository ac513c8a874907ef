package com.github.danielflower.mavenplugins.releaseplan.plan;

import java.util.Collections;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * State of one planning run: whether it was cancelled, and which warnings were already shown.
 */
public class UpdateRun {

    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final Set<String> announced = Collections.newSetFromMap(new ConcurrentHashMap<>());

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public void throwIfCancelled() {
        if (cancelled.get()) {
            throw new CancellationException("The release plan was cancelled");
        }
    }

    /**
     * @return true the first time it is called with a given key during this run
     */
    public boolean firstTime(String key) {
        return announced.add(key);
    }
}
