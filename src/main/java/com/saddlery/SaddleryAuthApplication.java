package com.saddlery;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SaddleryAuthApplication {

    public static void main(String[] args) {
        SpringApplication.run(SaddleryAuthApplication.class, args);
    }
}
