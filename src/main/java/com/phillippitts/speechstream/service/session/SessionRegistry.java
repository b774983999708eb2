package com.phillippitts.speechstream.service.session;

import com.phillippitts.speechstream.service.metrics.StreamingMetrics;
import com.phillippitts.speechstream.service.stt.EngineHandle;
import com.phillippitts.speechstream.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Maps session ids to {@link StreamingSession}s.
 *
 * <p>Two-level locking:
 * <ul>
 *   <li>{@code registryLock} guards the map only. It is held for insert, lookup and remove,
 *       never while an engine is invoked and never while waiting on a session lock.</li>
 *   <li>Each session's own lock serializes the work on that session's engine handle.</li>
 * </ul>
 * Lock order is session lock, then registry lock. Nothing acquires them the other way around.
 */
@Component
public class SessionRegistry {

    private static final Logger LOG = LogManager.getLogger(SessionRegistry.class);

    private final ReentrantLock registryLock = new ReentrantLock();

    // @GuardedBy("registryLock")
    private final Map<String, StreamingSession> sessions = new HashMap<>();

    public SessionRegistry(StreamingMetrics metrics) {
        Objects.requireNonNull(metrics, "metrics").registerActiveSessions(this::activeSessionCount);
    }

    /**
     * Returns the live session for the id, creating it on first reference.
     */
    public StreamingSession session(String sessionId) {
        Objects.requireNonNull(sessionId, "sessionId");
        registryLock.lock();
        try {
            StreamingSession existing = sessions.get(sessionId);
            if (existing != null) {
                return existing;
            }
            StreamingSession created = new StreamingSession(sessionId, Instant.now());
            sessions.put(sessionId, created);
            LOG.debug("Registered session {}", LogSanitizer.safeId(sessionId));
            return created;
        } finally {
            registryLock.unlock();
        }
    }

    /**
     * Returns the live session for the id without creating one.
     */
    public Optional<StreamingSession> find(String sessionId) {
        registryLock.lock();
        try {
            return Optional.ofNullable(sessions.get(sessionId));
        } finally {
            registryLock.unlock();
        }
    }

    /**
     * Per-session lock; creates the session on first reference.
     */
    public Lock lockFor(String sessionId) {
        return session(sessionId).lock();
    }

    /**
     * Handle bound to the live session. Caller holds that session's lock.
     *
     * @throws IllegalStateException if the session exists and its lock is not held
     */
    public Optional<EngineHandle> engineFor(String sessionId) {
        return find(sessionId).flatMap(StreamingSession::engineHandle);
    }

    /**
     * Binds a handle to a live session. Caller holds that session's lock.
     *
     * @throws IllegalStateException if the session is unknown, closed or already bound
     */
    public void bind(String sessionId, EngineHandle handle) {
        StreamingSession session = find(sessionId)
                .orElseThrow(() -> new IllegalStateException("Unknown session " + sessionId));
        session.bind(handle);
    }

    /**
     * Closes the live session with this id; see {@link #closeAndRemove(StreamingSession)}.
     */
    public Optional<EngineHandle> closeAndRemove(String sessionId) {
        return find(sessionId).flatMap(this::closeAndRemove);
    }

    /**
     * Marks the session closed, removes it from the map and hands over its engine handle.
     * Caller holds the session's lock and becomes responsible for closing the handle.
     *
     * @return the released handle, empty if the session never received audio or was already closed
     */
    public Optional<EngineHandle> closeAndRemove(StreamingSession session) {
        EngineHandle released = session.markClosed();
        registryLock.lock();
        try {
            // A fresh entry may already exist for the id; only remove this one
            sessions.remove(session.id(), session);
        } finally {
            registryLock.unlock();
        }
        LOG.debug("Closed session {}", LogSanitizer.safeId(session.id()));
        return Optional.ofNullable(released);
    }

    /**
     * @return true only while the id maps to an entry marked closed; removal clears the marker, so
     *     unknown and removed ids report false
     */
    public boolean isClosed(String sessionId) {
        return find(sessionId).map(StreamingSession::isClosed).orElse(false);
    }

    public int activeSessionCount() {
        registryLock.lock();
        try {
            return sessions.size();
        } finally {
            registryLock.unlock();
        }
    }

    /**
     * Closes sessions whose last activity is before {@code cutoff}. Sessions whose lock is held
     * (a request in flight) are skipped and looked at again on the next sweep.
     *
     * @return ids of the evicted sessions
     */
    public List<String> evictIdle(Instant cutoff) {
        List<StreamingSession> candidates = new ArrayList<>();
        registryLock.lock();
        try {
            for (StreamingSession s : sessions.values()) {
                if (s.lastActivity().isBefore(cutoff)) {
                    candidates.add(s);
                }
            }
        } finally {
            registryLock.unlock();
        }

        List<String> evicted = new ArrayList<>();
        for (StreamingSession s : candidates) {
            if (!s.lock().tryLock()) {
                continue;
            }
            try {
                if (s.isClosed() || !s.lastActivity().isBefore(cutoff)) {
                    continue;
                }
                closeAndRemove(s).ifPresent(EngineHandle::close);
                evicted.add(s.id());
            } finally {
                s.lock().unlock();
            }
        }
        return evicted;
    }
}
