package com.example.shiftsync;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ShiftSyncApplication {

    public static void main(String[] args) {
        SpringApplication.run(ShiftSyncApplication.class, args);
    }
}
