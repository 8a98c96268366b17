package com.example.shadowbrook;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@EnableScheduling
@SpringBootApplication
public class ShadowbrookApplication {

    public static void main(String[] args) {
        SpringApplication.run(ShadowbrookApplication.class, args);
    }
}
