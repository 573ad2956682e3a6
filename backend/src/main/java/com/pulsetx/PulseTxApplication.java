package com.pulsetx;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PulseTxApplication {

    public static void main(String[] args) {
        SpringApplication.run(PulseTxApplication.class, args);
    }
}
