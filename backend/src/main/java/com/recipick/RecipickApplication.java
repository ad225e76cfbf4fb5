package com.recipick;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class RecipickApplication {

    public static void main(String[] args) {
        SpringApplication.run(RecipickApplication.class, args);
    }
}
