package com.shlawgathon.faceguard.backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class FaceguardApplication {

    public static void main(String[] args) {
        SpringApplication.run(FaceguardApplication.class, args);
    }
}
