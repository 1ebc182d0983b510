package com.phillippitts.callintel;

import com.phillippitts.callintel.config.properties.ExtractionProperties;
import com.phillippitts.callintel.config.properties.PipelineProperties;
import com.phillippitts.callintel.config.properties.SpeechToTextProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableConfigurationProperties({
        PipelineProperties.class,
        ExtractionProperties.class,
        SpeechToTextProperties.class
})
@EnableScheduling
public class CallIntelApplication {

    public static void main(String[] args) {
        SpringApplication.run(CallIntelApplication.class, args);
    }

}
