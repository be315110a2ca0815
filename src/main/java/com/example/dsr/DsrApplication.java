package com.example.dsr;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class DsrApplication {
    public static void main(String[] args) {
        SpringApplication.run(DsrApplication.class, args);
    }
}
