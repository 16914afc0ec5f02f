package com.example.kiosksync;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class KioskSyncApplication {

    public static void main(String[] args) {
        SpringApplication.run(KioskSyncApplication.class, args);
    }
}
