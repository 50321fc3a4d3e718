package com.promptcraft.api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication(scanBasePackages = "com.promptcraft")
public class PromptCraftApiApplication {
    
    public static void main(String[] args) {
        SpringApplication.run(PromptCraftApiApplication.class, args);
    }
}
