package com.rater;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class RaterApplication {

    public static void main(String[] args) {
        SpringApplication.run(RaterApplication.class, args);
    }
}
