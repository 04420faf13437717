package com.nectarstudio.realtime;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling // Necessary to enable the @Scheduled annotation
@ConfigurationPropertiesScan
public class RealtimeSyncApplication {
    public static void main(String[] args) {
        SpringApplication.run(RealtimeSyncApplication.class, args);
    }
}
