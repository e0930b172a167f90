package com.example.outline;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class OutlineApplication {

    public static void main(String[] args) {
        SpringApplication.run(OutlineApplication.class, args);
    }
}
