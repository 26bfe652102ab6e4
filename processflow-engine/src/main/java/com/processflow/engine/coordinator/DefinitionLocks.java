package com.processflow.engine.coordinator;

import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

/**
 * Per-definition read/write locks shared by the process and definition coordinators.
 * Starting an instance holds the read side, so starts of one definition run in parallel;
 * deleting the definition holds the write side and waits for in-flight starts.
 */
public class DefinitionLocks {

    private final ConcurrentMap<UUID, ReentrantReadWriteLock> locks = new ConcurrentHashMap<>();

    public <T> T withShared(UUID definitionId, Supplier<T> action) {
        return callLocked(lockFor(definitionId).readLock(), action);
    }

    public void withExclusive(UUID definitionId, Runnable action) {
        callLocked(lockFor(definitionId).writeLock(), () -> {
            action.run();
            return null;
        });
    }

    private ReentrantReadWriteLock lockFor(UUID definitionId) {
        return locks.computeIfAbsent(definitionId, id -> new ReentrantReadWriteLock(true));
    }

    private static <T> T callLocked(Lock lock, Supplier<T> action) {
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }
}
