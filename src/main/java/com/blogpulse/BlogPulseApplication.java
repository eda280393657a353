package com.blogpulse;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class BlogPulseApplication {

    public static void main(String[] args) {
        SpringApplication.run(BlogPulseApplication.class, args);
    }
}
