package com.phillippitts.labreasoning;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableConfigurationProperties({
        com.phillippitts.labreasoning.config.properties.PipelineProperties.class,
        com.phillippitts.labreasoning.config.properties.ConsensusProperties.class,
        com.phillippitts.labreasoning.config.properties.ModelClientProperties.class
})
@EnableScheduling
public class LabReasoningApplication {

    public static void main(String[] args) {
        SpringApplication.run(LabReasoningApplication.class, args);
    }

}
