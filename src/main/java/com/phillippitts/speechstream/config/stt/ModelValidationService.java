package com.phillippitts.speechstream.config.stt;

import com.phillippitts.speechstream.exception.ModelNotFoundException;
import jakarta.annotation.PostConstruct;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Validates presence of the Vosk model directory at startup.
 *
 * <p>Aborts startup with an actionable error when the model directory is missing or lacks the
 * {@code am} and {@code conf} subdirectories. Set {@code stt.validation.enabled=false} to start
 * without a model; {@code /health} then reports {@code model_loaded=false} and recognition
 * endpoints answer HTTP 500.
 */
@Component
@ConditionalOnProperty(name = "stt.validation.enabled", havingValue = "true", matchIfMissing = true)
class ModelValidationService {

    private static final Logger LOG = LogManager.getLogger(ModelValidationService.class);

    private final VoskConfig vosk;

    ModelValidationService(VoskConfig vosk) {
        this.vosk = vosk;
    }

    @PostConstruct
    void validateOnStartup() {
        LOG.info("Validating Vosk model... os={}, arch={}",
            System.getProperty("os.name"), System.getProperty("os.arch"));

        Path modelDir = resolve(vosk.modelPath());
        validateVoskDirectoryStructure(modelDir);

        LOG.info("Model validation complete: vosk.model='{}'", modelDir);
    }

    // Package-private to enable hermetic tests without JNI or real model
    void validateVoskDirectoryStructure(Path modelDir) {
        if (!Files.isDirectory(modelDir)) {
            throw new ModelNotFoundException(modelDir.toString());
        }
        // Basic expected structure (these vary across models; keep lenient but helpful)
        if (!Files.isDirectory(modelDir.resolve("am")) || !Files.isDirectory(modelDir.resolve("conf"))) {
            throw new ModelNotFoundException("Missing expected Vosk model subdirectories under: " + modelDir);
        }
    }

    private Path resolve(String pathString) {
        Path path = Paths.get(pathString);
        if (!path.isAbsolute()) {
            Path resolved = Paths.get(".").toAbsolutePath().normalize().resolve(path).normalize();
            LOG.warn("Vosk model uses relative path '{}' - resolved to '{}'", pathString, resolved);
            return resolved;
        }
        return path;
    }
}
