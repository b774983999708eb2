package com.phillippitts.speechstream.config.stt;

import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import jakarta.validation.ValidatorFactory;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class VoskConfigTest {

    private static ValidatorFactory factory;
    private static Validator validator;

    @BeforeAll
    static void setUp() {
        factory = Validation.buildDefaultValidatorFactory();
        validator = factory.getValidator();
    }

    @AfterAll
    static void tearDown() {
        factory.close();
    }

    @Test
    void defaultsPointAtSmallEnglishModel() {
        VoskConfig config = new VoskConfig();

        assertThat(config.modelPath()).isEqualTo("./models/vosk-model-small-en-us-0.15");
        assertThat(config.sampleRate()).isEqualTo(16_000);
        assertThat(validator.validate(config)).isEmpty();
    }

    @Test
    void rejectsBlankModelPath() {
        Set<ConstraintViolation<VoskConfig>> violations = validator.validate(new VoskConfig(" ", 16_000));

        assertThat(violations).extracting(ConstraintViolation::getMessage)
                .containsExactly("Vosk model path must not be blank");
    }

    @Test
    void rejectsNonPositiveSampleRate() {
        Set<ConstraintViolation<VoskConfig>> violations = validator.validate(new VoskConfig("/models/x", 0));

        assertThat(violations).extracting(ConstraintViolation::getMessage)
                .containsExactly("Sample rate must be positive");
    }
}
