package com.fixguard;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class FixGuardApplication {

    public static void main(String[] args) {
        SpringApplication.run(FixGuardApplication.class, args);
    }
}
