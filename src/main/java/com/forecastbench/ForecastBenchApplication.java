package com.forecastbench;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ForecastBenchApplication {

    public static void main(String[] args) {
        SpringApplication.run(ForecastBenchApplication.class, args);
    }
}
