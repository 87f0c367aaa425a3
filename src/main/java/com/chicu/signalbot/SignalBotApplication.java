package com.chicu.signalbot;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication(scanBasePackages = "com.chicu.signalbot")
@ConfigurationPropertiesScan("com.chicu.signalbot")
public class SignalBotApplication {

    public static void main(String[] args) {
        SpringApplication.run(SignalBotApplication.class, args);
    }
}
