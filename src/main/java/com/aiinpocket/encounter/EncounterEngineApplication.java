package com.aiinpocket.encounter;

import com.aiinpocket.encounter.config.EncounterProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(EncounterProperties.class)
public class EncounterEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(EncounterEngineApplication.class, args);
    }

}
