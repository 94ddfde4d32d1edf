package com.lumen;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class LumenApplication {

    public static void main(String[] args) {
        SpringApplication.run(LumenApplication.class, args);
    }
}
