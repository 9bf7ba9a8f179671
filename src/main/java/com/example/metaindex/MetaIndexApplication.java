package com.example.metaindex;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class MetaIndexApplication {

    public static void main(String[] args) {
        SpringApplication.run(MetaIndexApplication.class, args);
    }
}
