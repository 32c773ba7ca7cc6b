package com.spreadpool;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SpreadPoolApplication {
    public static void main(String[] args) {
        SpringApplication.run(SpreadPoolApplication.class, args);
    }
}
