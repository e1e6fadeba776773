package com.capstone.drivesync;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class DriveSyncApplication {

    public static void main(String[] args) {
        SpringApplication.run(DriveSyncApplication.class, args);
    }
}
