package com.example.particlesync;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ParticleSyncApplication {

    public static void main(String[] args) {
        SpringApplication.run(ParticleSyncApplication.class, args);
    }
}
