package com.lpradar;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class LpRadarApplication {

    public static void main(String[] args) {
        SpringApplication.run(LpRadarApplication.class, args);
    }
}
