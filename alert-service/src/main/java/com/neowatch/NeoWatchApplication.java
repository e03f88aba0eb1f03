package com.neowatch;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class NeoWatchApplication {

    public static void main(String[] args) {
        SpringApplication.run(NeoWatchApplication.class, args);
    }
}
