package com.tenacy.labpulse;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class LabPulseApplication {

    public static void main(String[] args) {
        SpringApplication.run(LabPulseApplication.class, args);
    }
}
