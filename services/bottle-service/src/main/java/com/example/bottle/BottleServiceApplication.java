package com.example.bottle;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class BottleServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(BottleServiceApplication.class, args);
    }
}
