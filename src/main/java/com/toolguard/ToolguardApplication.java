package com.toolguard;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ToolguardApplication {

    public static void main(String[] args) {
        SpringApplication.run(ToolguardApplication.class, args);
    }
}
