package com.phillippitts.speechstream.testutil;

import com.phillippitts.speechstream.service.stt.EngineHandle;
import org.json.JSONObject;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Test double for {@link EngineHandle} that records what it was fed.
 *
 * <p>Tracks how many {@link #acceptWaveform(byte[])} calls overlap, so tests can assert that a
 * session's handle is never used by two requests at once.
 *
 * <p><b>Mutable fields:</b> {@code partialText}, {@code resultText}, {@code finalText},
 * {@code boundary}, {@code failure} and {@code acceptDelayMs} are public for per-test scripting.
 */
public class FakeEngineHandle implements EngineHandle {

    public volatile String partialText = "";
    public volatile String resultText = "";
    public volatile String finalText = "";
    public volatile boolean boundary = false;
    public volatile RuntimeException failure;
    public volatile long acceptDelayMs = 0;

    /** When set, every accept blocks until the latch is released. */
    public volatile CountDownLatch acceptGate;

    private final List<byte[]> accepted = new CopyOnWriteArrayList<>();
    private final AtomicInteger inFlight = new AtomicInteger();
    private final AtomicInteger maxInFlight = new AtomicInteger();
    private final AtomicInteger finalCalls = new AtomicInteger();
    private volatile boolean closed;

    @Override
    public boolean acceptWaveform(byte[] pcm) {
        if (closed) {
            throw new IllegalStateException("handle closed");
        }
        int now = inFlight.incrementAndGet();
        maxInFlight.accumulateAndGet(now, Math::max);
        try {
            accepted.add(pcm.clone());
            CountDownLatch gate = acceptGate;
            if (gate != null) {
                gate.await(5, TimeUnit.SECONDS);
            }
            if (acceptDelayMs > 0) {
                Thread.sleep(acceptDelayMs);
            }
            if (failure != null) {
                throw failure;
            }
            return boundary;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("interrupted", e);
        } finally {
            inFlight.decrementAndGet();
        }
    }

    @Override
    public String partialResult() {
        return new JSONObject().put("partial", partialText).toString();
    }

    @Override
    public String result() {
        return new JSONObject().put("text", resultText).toString();
    }

    @Override
    public String finalResult() {
        if (closed) {
            throw new IllegalStateException("handle closed");
        }
        finalCalls.incrementAndGet();
        return new JSONObject().put("text", finalText).toString();
    }

    @Override
    public void close() {
        closed = true;
    }

    public boolean isClosed() {
        return closed;
    }

    public List<byte[]> accepted() {
        return accepted;
    }

    public int maxConcurrentAccepts() {
        return maxInFlight.get();
    }

    public int finalCalls() {
        return finalCalls.get();
    }
}
