package com.vrforacle;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class VrfOracleApplication {

    public static void main(String[] args) {
        SpringApplication.run(VrfOracleApplication.class, args);
    }
}
