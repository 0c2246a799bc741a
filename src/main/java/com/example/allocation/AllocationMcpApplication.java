package com.example.allocation;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class AllocationMcpApplication {

    public static void main(String[] args) {
        SpringApplication.run(AllocationMcpApplication.class, args);
    }
}
