package com.hometown.happiness;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class HometownHappinessApplication {
    public static void main(String[] args) {
        SpringApplication.run(HometownHappinessApplication.class, args);
    }
}
