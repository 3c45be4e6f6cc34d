package com.askdb;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class AskDbApplication {

    public static void main(String[] args) {
        SpringApplication.run(AskDbApplication.class, args);
    }
}
