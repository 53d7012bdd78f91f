package com.company.silencing;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SilenceEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(SilenceEngineApplication.class, args);
    }
}
