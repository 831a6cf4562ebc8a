package com.sessionhub.ingestion;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class SessionAssetIngestionApplication {

    public static void main(String[] args) {
        SpringApplication.run(SessionAssetIngestionApplication.class, args);
    }
}
