package com.querygate;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class QueryGateApplication {

    public static void main(String[] args) {
        SpringApplication.run(QueryGateApplication.class, args);
    }
}
