package com.phillippitts.fonemas;

import com.phillippitts.fonemas.cli.TranscribeCommand;
import com.phillippitts.fonemas.config.transcription.SyllabifierProperties;
import com.phillippitts.fonemas.config.transcription.TranscriptionProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.core.env.Profiles;

/**
 * Spring Boot entry point. Serves the REST API by default; with the {@code cli} profile it
 * transcribes its arguments once and exits with the command's exit code.
 */
@SpringBootApplication
@EnableConfigurationProperties({
        TranscriptionProperties.class,
        SyllabifierProperties.class
})
public class FonemasApplication {

    public static void main(String[] args) {
        ConfigurableApplicationContext context = SpringApplication.run(FonemasApplication.class, args);
        if (context.getEnvironment().acceptsProfiles(Profiles.of(TranscribeCommand.PROFILE))) {
            System.exit(SpringApplication.exit(context));
        }
    }

}
