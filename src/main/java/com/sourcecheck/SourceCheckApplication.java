package com.sourcecheck;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SourceCheckApplication {

    public static void main(String[] args) {
        SpringApplication.run(SourceCheckApplication.class, args);
    }
}
