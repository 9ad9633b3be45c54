package com.spreadbook;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SpreadbookApplication {

    public static void main(String[] args) {
        SpringApplication.run(SpreadbookApplication.class, args);
    }
}
