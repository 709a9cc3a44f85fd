package io.campus.core.session;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * One exclusive lock per session id. Entries are reference counted and removed once no holder or waiter
 * remains, so idle sessions cost nothing.
 */
public final class SessionLocks {
    private final Map<String, Entry> locks = new ConcurrentHashMap<>();

    public Held acquire(String sessionId) {
        Entry entry = locks.compute(sessionId, (key, existing) -> {
            Entry value = existing == null ? new Entry() : existing;
            value.refs++;
            return value;
        });
        entry.lock.lock();
        return () -> {
            entry.lock.unlock();
            locks.computeIfPresent(sessionId, (key, existing) -> --existing.refs == 0 ? null : existing);
        };
    }

    public int activeSessions() {
        return locks.size();
    }

    public interface Held extends AutoCloseable {
        @Override
        void close();
    }

    private static final class Entry {
        private final ReentrantLock lock = new ReentrantLock();
        private int refs;
    }
}
