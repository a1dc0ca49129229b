package com.formalverify;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class FormalVerificationApplication {

    public static void main(String[] args) {
        SpringApplication.run(FormalVerificationApplication.class, args);
    }
}
