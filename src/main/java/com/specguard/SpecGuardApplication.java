package com.specguard;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SpecGuardApplication {

    public static void main(String[] args) {
        SpringApplication.run(SpecGuardApplication.class, args);
    }
}
