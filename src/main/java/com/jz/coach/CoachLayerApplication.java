package com.jz.coach;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan(basePackages = "com.jz.coach")
public class CoachLayerApplication {
    public static void main(String[] args) {
        SpringApplication.run(CoachLayerApplication.class, args);
    }
}
