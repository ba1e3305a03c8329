package com.vedicchart.engine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ChartEngineApplication {
    public static void main(String[] args) {
        SpringApplication.run(ChartEngineApplication.class, args);
    }
}
