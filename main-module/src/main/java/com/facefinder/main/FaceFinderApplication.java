package com.facefinder.main;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication(scanBasePackages = "com.facefinder")
@ConfigurationPropertiesScan("com.facefinder.main.config")
@EnableScheduling
public class FaceFinderApplication {

    public static void main(String[] args) {
        SpringApplication.run(FaceFinderApplication.class, args);
    }
}
