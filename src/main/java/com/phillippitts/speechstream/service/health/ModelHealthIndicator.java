package com.phillippitts.speechstream.service.health;

import com.phillippitts.speechstream.config.stt.VoskConfig;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Health indicator for the recognition model directory.
 *
 * <p>Exposed via /actuator/health endpoint.
 */
@Component
public class ModelHealthIndicator implements HealthIndicator {

    private final VoskConfig voskConfig;

    public ModelHealthIndicator(VoskConfig voskConfig) {
        this.voskConfig = voskConfig;
    }

    @Override
    public Health health() {
        Path modelPath = Paths.get(voskConfig.modelPath());
        boolean exists = Files.isDirectory(modelPath);

        Health.Builder builder = exists ? Health.up() : Health.down();
        return builder
                .withDetail("status", exists ? "Model directory accessible" : "Model directory missing")
                .withDetail("voskModel", formatStatus(exists, modelPath))
                .build();
    }

    private String formatStatus(boolean exists, Path path) {
        if (exists) {
            return "accessible at " + path;
        }
        return "NOT FOUND at " + path;
    }
}
