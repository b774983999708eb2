package com.phillippitts.speechstream.testutil;

import com.phillippitts.speechstream.exception.EngineUnavailableException;
import com.phillippitts.speechstream.service.stt.RecognitionEngine;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Supplier;

/**
 * Test double for {@link RecognitionEngine} handing out {@link FakeEngineHandle}s.
 *
 * <p>Allows tests to control:
 * <ul>
 *   <li>Health status (unhealthy engines refuse to create handles)</li>
 *   <li>The handles created (via {@link #handleFactory})</li>
 *   <li>A failure on handle creation</li>
 * </ul>
 */
public class FakeRecognitionEngine implements RecognitionEngine {

    public static final String NAME = "fake";

    public volatile boolean healthy = true;
    public volatile Supplier<FakeEngineHandle> handleFactory = FakeEngineHandle::new;
    public volatile RuntimeException createFailure;

    private final List<FakeEngineHandle> handles = new CopyOnWriteArrayList<>();
    private final List<Integer> requestedSampleRates = new CopyOnWriteArrayList<>();

    @Override
    public void initialize() {
        // No-op for fake
    }

    @Override
    public FakeEngineHandle createHandle(int sampleRate) {
        if (!healthy) {
            throw new EngineUnavailableException(NAME);
        }
        if (createFailure != null) {
            throw createFailure;
        }
        FakeEngineHandle handle = handleFactory.get();
        handles.add(handle);
        requestedSampleRates.add(sampleRate);
        return handle;
    }

    @Override
    public String getEngineName() {
        return NAME;
    }

    @Override
    public boolean isHealthy() {
        return healthy;
    }

    @Override
    public void close() {
        // No-op for fake
    }

    public List<FakeEngineHandle> handles() {
        return handles;
    }

    public FakeEngineHandle lastHandle() {
        return handles.isEmpty() ? null : handles.get(handles.size() - 1);
    }

    public List<Integer> requestedSampleRates() {
        return requestedSampleRates;
    }

    /**
     * Restores defaults between tests sharing one Spring context.
     */
    public void reset() {
        healthy = true;
        handleFactory = FakeEngineHandle::new;
        createFailure = null;
        handles.clear();
        requestedSampleRates.clear();
    }
}
