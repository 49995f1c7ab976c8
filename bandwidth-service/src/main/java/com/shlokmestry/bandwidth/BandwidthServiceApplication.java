package com.shlokmestry.bandwidth;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class BandwidthServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(BandwidthServiceApplication.class, args);
    }
}
