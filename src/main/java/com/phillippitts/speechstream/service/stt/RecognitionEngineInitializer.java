package com.phillippitts.speechstream.service.stt;

import jakarta.annotation.PostConstruct;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.util.Objects;

/**
 * Loads the recognition model at startup.
 *
 * <p>A failed load is logged, not rethrown: the service still starts, {@code /health} reports
 * {@code model_loaded=false} and recognition endpoints answer HTTP 500 until the model is fixed.
 */
@Component
public class RecognitionEngineInitializer {

    private static final Logger LOG = LogManager.getLogger(RecognitionEngineInitializer.class);

    private final RecognitionEngine engine;

    public RecognitionEngineInitializer(RecognitionEngine engine) {
        this.engine = Objects.requireNonNull(engine, "engine");
    }

    @PostConstruct
    public void initializeEngine() {
        LOG.info("Initializing recognition engine {} at startup...", engine.getEngineName());
        try {
            engine.initialize();
            LOG.info("Engine {} initialized successfully", engine.getEngineName());
        } catch (Exception ex) {
            LOG.error("Failed to initialize engine {} at startup: {}", engine.getEngineName(), ex.toString());
        }
    }
}
