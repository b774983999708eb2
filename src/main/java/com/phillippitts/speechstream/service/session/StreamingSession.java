package com.phillippitts.speechstream.service.session;

import com.phillippitts.speechstream.service.stt.EngineHandle;

import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * One streaming client session: its lock, its exclusively owned engine handle and its closed
 * marker.
 *
 * <p>The handle and the closed marker are only changed while {@link #lock()} is held by the
 * current thread. Once closed, a session never gets a handle again; the registry removes it in
 * the same critical section and the id starts over with a new entry.
 */
public final class StreamingSession {

    private final String id;
    private final ReentrantLock lock = new ReentrantLock();

    // @GuardedBy("lock")
    private EngineHandle handle;

    private volatile boolean closed;
    private volatile Instant lastActivity;

    StreamingSession(String id, Instant createdAt) {
        this.id = id;
        this.lastActivity = createdAt;
    }

    public String id() {
        return id;
    }

    /**
     * @return the lock serializing all engine work for this session
     */
    public ReentrantLock lock() {
        return lock;
    }

    public boolean isClosed() {
        return closed;
    }

    public Instant lastActivity() {
        return lastActivity;
    }

    /**
     * @throws IllegalStateException if the lock is not held by the current thread
     */
    public Optional<EngineHandle> engineHandle() {
        requireLockHeld();
        return Optional.ofNullable(handle);
    }

    void touch(Instant now) {
        lastActivity = now;
    }

    /**
     * Binds the engine handle. Allowed once per session lifetime.
     *
     * @throws IllegalStateException if the lock is not held, the session is closed, or a handle is already bound
     */
    void bind(EngineHandle engineHandle) {
        requireLockHeld();
        if (closed) {
            throw new IllegalStateException("Session " + id + " is closed");
        }
        if (handle != null) {
            throw new IllegalStateException("Session " + id + " already has an engine handle");
        }
        handle = engineHandle;
    }

    /**
     * Marks the session closed and hands over its engine handle.
     *
     * @return the released handle, or null if none was ever bound
     */
    EngineHandle markClosed() {
        requireLockHeld();
        closed = true;
        EngineHandle released = handle;
        handle = null;
        return released;
    }

    private void requireLockHeld() {
        if (!lock.isHeldByCurrentThread()) {
            throw new IllegalStateException("Session lock for " + id + " not held by current thread");
        }
    }

    @Override
    public String toString() {
        return "StreamingSession{id=" + id + ", closed=" + closed + ", bound=" + (handle != null) + '}';
    }
}
