package com.phillippitts.voicedispatch;

import com.phillippitts.voicedispatch.config.properties.DispatcherProperties;
import com.phillippitts.voicedispatch.config.properties.PurpleAirProperties;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({
        DispatcherProperties.class,
        PurpleAirProperties.class
})
public class VoiceDispatchApplication {

    public static void main(String[] args) {
        // Clipboard and keyboard components need a display
        new SpringApplicationBuilder(VoiceDispatchApplication.class)
                .headless(false)
                .run(args);
    }

}
