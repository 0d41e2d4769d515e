package com.hubsync;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class HubSyncApplication {

    public static void main(String[] args) {
        SpringApplication.run(HubSyncApplication.class, args);
    }
}
