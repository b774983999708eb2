package com.phillippitts.speechstream;

import com.phillippitts.speechstream.config.properties.AudioValidationProperties;
import com.phillippitts.speechstream.config.properties.StreamingSessionProperties;
import com.phillippitts.speechstream.config.stt.VoskConfig;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableConfigurationProperties({
        VoskConfig.class,
        StreamingSessionProperties.class,
        AudioValidationProperties.class
})
@EnableScheduling
public class SpeechStreamApplication {

    public static void main(String[] args) {
        SpringApplication.run(SpeechStreamApplication.class, args);
    }

}
