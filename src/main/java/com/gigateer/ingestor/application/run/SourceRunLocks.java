package com.gigateer.ingestor.application.run;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Guards against two runs of the same source executing at once.
 * Not reentrant: a second acquire for a held source fails even on the same thread.
 */
public class SourceRunLocks {

    private final Set<String> running = ConcurrentHashMap.newKeySet();

    /**
     * @return true if the caller now owns the source and must {@link #release} it
     */
    public boolean tryAcquire(String sourceId) {
        return running.add(sourceId);
    }

    public void release(String sourceId) {
        running.remove(sourceId);
    }

    public boolean isRunning(String sourceId) {
        return running.contains(sourceId);
    }
}
