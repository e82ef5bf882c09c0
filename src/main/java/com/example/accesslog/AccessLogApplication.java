package com.example.accesslog;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class AccessLogApplication {

    public static void main(String[] args) {
        SpringApplication.run(AccessLogApplication.class, args);
    }
}
