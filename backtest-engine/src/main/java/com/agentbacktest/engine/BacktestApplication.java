package com.agentbacktest.engine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication(scanBasePackages = "com.agentbacktest")
public class BacktestApplication {

    public static void main(String[] args) {
        SpringApplication.run(BacktestApplication.class, args);
    }
}
